package com.zzf.coder.core.tool;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Noise filters shared by ls, tree and grep: VCS metadata, dependency folders,
 * build outputs, caches, editor files and logs.
 */
final class IgnorePatterns {

    static final List<String> DEFAULT = List.of(
            // VCS
            ".git/**", ".svn/**", ".hg/**",
            // dependencies
            "node_modules/**", "bower_components/**", "vendor/**", "packages/**",
            // python
            "__pycache__/**", "*.pyc", "*.pyo", "*.pyd", ".Python", "venv/**", ".venv/**", "env/**", ".env/**",
            "ENV/**", "*.egg-info/**", ".eggs/**", ".pytest_cache/**", ".mypy_cache/**", ".tox/**",
            // js
            ".next/**", ".nuxt/**", "out/**", ".cache/**", ".parcel-cache/**", ".turbo/**",
            // build outputs
            "dist/**", "build/**", "target/**", "bin/**", "obj/**",
            // editors
            ".vscode/**", ".idea/**", "*.swp", "*.swo", "*~",
            // logs and coverage
            "*.log", "logs/**", "*.log.*", "coverage/**", ".coverage", ".nyc_output/**", "htmlcov/**",
            // toolchains
            "Cargo.lock", "go.sum", ".bundle/**", "*.class", ".gradle/**", ".mvn/**",
            // temp and OS files
            "tmp/**", "temp/**", "*.tmp", "*.bak", ".DS_Store", "Thumbs.db", "desktop.ini",
            // agent checkpoints
            ".coder-agent/**"
    );

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".zip", ".tar", ".gz", ".exe", ".dll", ".so", ".class", ".jar", ".war", ".7z",
            ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx", ".odt", ".ods", ".odp",
            ".bin", ".dat", ".obj", ".o", ".a", ".lib", ".wasm", ".pyc", ".pyo",
            ".png", ".jpg", ".jpeg", ".gif", ".bmp", ".ico", ".webp", ".pdf", ".mp3", ".mp4"
    );

    private final List<PathMatcher> matchers;

    private IgnorePatterns(List<String> patterns) {
        List<PathMatcher> list = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            String clean = pattern.endsWith("/**") ? pattern.substring(0, pattern.length() - 3) : pattern;
            list.add(FileSystems.getDefault().getPathMatcher("glob:" + clean));
        }
        this.matchers = list;
    }

    static IgnorePatterns defaults() {
        return new IgnorePatterns(DEFAULT);
    }

    static IgnorePatterns defaultsPlus(List<String> extra) {
        List<String> all = new ArrayList<>(DEFAULT);
        if (extra != null) {
            all.addAll(extra);
        }
        return new IgnorePatterns(all);
    }

    /** Patterns are matched against the entry's own name. */
    boolean ignored(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    static boolean binaryByName(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && BINARY_EXTENSIONS.contains(name.substring(dot));
    }
}
