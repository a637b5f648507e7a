package com.zzf.coder.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.core.reasoning.ReasoningReplyParser;
import com.zzf.coder.core.tool.Tool;
import com.zzf.coder.core.tool.ToolRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, LlmProperties.class, McpProperties.class})
public class AgentConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("coder-tool-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("coder-session-"));
    }

    @Bean
    public ToolRegistry toolRegistry(List<Tool> builtInTools) {
        ToolRegistry registry = new ToolRegistry();
        builtInTools.forEach(registry::register);
        return registry;
    }

    @Bean
    public ReasoningReplyParser reasoningReplyParser(ObjectMapper objectMapper) {
        return new ReasoningReplyParser(objectMapper);
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
