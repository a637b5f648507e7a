package com.zzf.coder.shell;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Shell 服务: picks the shell for command tools and kills process trees.
 */
@Slf4j
@Service
public class ShellService {

    private static final long SIGKILL_TIMEOUT_MS = 200;
    private static final Set<String> BLACKLIST = Set.of("fish", "nu");

    /** Terminates the process and every descendant, escalating to a forced kill. */
    public void killTree(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        long pid = process.pid();
        log.info("shell.kill pid={}", pid);

        if (isWindows()) {
            try {
                new ProcessBuilder("taskkill", "/pid", String.valueOf(pid), "/f", "/t")
                        .redirectErrorStream(true)
                        .start()
                        .waitFor(5, TimeUnit.SECONDS);
            } catch (IOException e) {
                log.warn("shell.kill.failed pid={} err={}", pid, e.toString());
                process.destroyForcibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
            return;
        }

        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(SIGKILL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
    }

    public String preferred() {
        String shell = System.getenv("SHELL");
        if (shell != null && !shell.isBlank()) {
            String name = Paths.get(shell).getFileName().toString();
            if (!BLACKLIST.contains(name)) {
                return shell;
            }
        }
        return fallback();
    }

    /** Builds the argv that runs {@code command} through {@code shell}. */
    public List<String> commandLine(String shell, String command) {
        String lower = shell.toLowerCase();
        if (lower.endsWith("cmd.exe")) {
            return List.of(shell, "/c", command);
        }
        if (lower.endsWith("powershell.exe") || lower.endsWith("pwsh.exe") || lower.endsWith("pwsh") || lower.endsWith("powershell")) {
            return List.of(shell, "-NoProfile", "-NonInteractive", "-Command", command);
        }
        return List.of(shell, "-c", command);
    }

    private String fallback() {
        if (isWindows()) {
            String[] commonPaths = {
                    "C:\\Program Files\\Git\\bin\\bash.exe",
                    "C:\\Program Files (x86)\\Git\\bin\\bash.exe"
            };
            for (String path : commonPaths) {
                if (new File(path).exists()) {
                    return path;
                }
            }
            String comspec = System.getenv("COMSPEC");
            return comspec != null ? comspec : "cmd.exe";
        }
        if (System.getProperty("os.name", "").toLowerCase().contains("mac")) {
            return "/bin/zsh";
        }
        String bash = which("bash");
        return bash != null ? bash : "/bin/sh";
    }

    private String which(String cmd) {
        try {
            Process p = new ProcessBuilder("which", cmd).start();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                if (line != null && !line.isEmpty() && Path.of(line).toFile().canExecute()) {
                    return line;
                }
            }
        } catch (IOException e) {
            log.debug("shell.which.failed cmd={} err={}", cmd, e.toString());
        }
        return null;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }
}
