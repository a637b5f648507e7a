package com.zzf.coder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coder.llm")
public class LlmProperties {
    private String apiKey = "";
    private String baseUrl = "https://api.openai.com/v1";
    private String modelName = "gpt-4o-mini";
    private double temperature = 0.0;
    private int timeoutSeconds = 120;
}
