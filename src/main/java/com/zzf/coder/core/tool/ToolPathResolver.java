package com.zzf.coder.core.tool;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves tool path arguments against the session's project root.
 * Resolved paths never leave the root.
 */
final class ToolPathResolver {

    private ToolPathResolver() {
    }

    static Path projectRoot(Tool.Context ctx) {
        Path root = ctx == null ? null : ctx.getProjectRoot();
        if (root == null) {
            root = Paths.get(System.getProperty("user.dir"));
        }
        return root.toAbsolutePath().normalize();
    }

    static Path resolve(Tool.Context ctx, String rawPath) {
        Path root = projectRoot(ctx);
        if (rawPath == null || rawPath.isBlank() || ".".equals(rawPath.trim())) {
            return root;
        }
        Path parsed;
        try {
            parsed = Paths.get(rawPath.trim());
        } catch (InvalidPathException e) {
            throw new ToolExecutionException("invalid path '" + rawPath + "': " + e.getReason());
        }
        Path resolved = parsed.isAbsolute() ? parsed.normalize() : root.resolve(parsed).normalize();
        if (!resolved.startsWith(root)) {
            throw new ToolExecutionException("path '" + rawPath + "' is outside the project root " + root);
        }
        return resolved;
    }

    /** Root-relative path with forward slashes; "." for the root itself. */
    static String relative(Tool.Context ctx, Path target) {
        Path root = projectRoot(ctx);
        Path normalized = target.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return normalized.toString().replace('\\', '/');
        }
        String rel = root.relativize(normalized).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }
}
