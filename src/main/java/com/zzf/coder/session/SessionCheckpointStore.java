package com.zzf.coder.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON checkpoints under {@code <projectRoot>/.coder-agent/sessions/<id>.json}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCheckpointStore {

    private final ObjectMapper objectMapper;
    private final AgentProperties properties;

    public boolean isEnabled() {
        return properties.getCheckpoint().isEnabled();
    }

    public Path pathFor(Path projectRoot, String sessionId) {
        return projectRoot.resolve(properties.getCheckpoint().getDirectory()).resolve(sessionId + ".json");
    }

    /** Writes through a temp file so a crash never leaves a half-written checkpoint. */
    public void save(Session session) {
        Path target = pathFor(session.getProjectRoot(), session.getId());
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), SessionCheckpoint.of(session));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("checkpoint.saved sessionId={} path={}", session.getId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write checkpoint " + target, e);
        }
    }

    public Optional<SessionCheckpoint> load(Path projectRoot, String sessionId) {
        Path file = pathFor(projectRoot, sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SessionCheckpoint.class));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read checkpoint " + file, e);
        }
    }
}
