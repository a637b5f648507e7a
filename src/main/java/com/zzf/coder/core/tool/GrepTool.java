package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.config.ToolProperties;
import com.zzf.coder.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * GrepTool: regex search over project files, skipping ignored folders and binaries.
 */
@Component
@Slf4j
public class GrepTool implements Tool {
    static final String MODE_CONTENT = "content";
    static final String MODE_FILES = "files_with_matches";
    static final String MODE_COUNT = "count";

    private static final long MAX_FILE_BYTES = 2L * 1024 * 1024;
    private static final int MAX_LINE_CHARS = 400;

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("pattern", ToolSchema.Type.STRING, "The regular expression to search for in file contents")
            .optional("path", ToolSchema.Type.STRING, "File or directory to search in. Defaults to the project root")
            .optional("glob", ToolSchema.Type.STRING, "Glob pattern to filter files, e.g. \"*.java\" or \"src/**/*.{ts,tsx}\"")
            .optional("ignoreCase", ToolSchema.Type.BOOLEAN, "Case insensitive search")
            .optional("maxResults", ToolSchema.Type.INTEGER, "Maximum number of results to return")
            .optionalEnum("outputMode", "content (default) lists matching lines, files_with_matches lists paths, count lists per-file counts",
                    List.of(MODE_CONTENT, MODE_FILES, MODE_COUNT))
            .build();

    private final ToolProperties properties;

    public GrepTool(ToolProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getId() {
        return "grep";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Searches file contents with a regular expression. Always use this tool for search tasks instead of running grep in bash.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return ctx.async(() -> {
            String patternText = JsonUtils.text(args, "pattern", "");
            boolean ignoreCase = args.path("ignoreCase").asBoolean(false);
            Pattern pattern;
            try {
                pattern = Pattern.compile(patternText, ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
            } catch (PatternSyntaxException e) {
                throw new ToolExecutionException("invalid regex: " + e.getDescription());
            }
            Path searchPath = ToolPathResolver.resolve(ctx, JsonUtils.text(args, "path", null));
            if (!Files.exists(searchPath)) {
                throw new ToolExecutionException("path '" + ToolPathResolver.relative(ctx, searchPath) + "' does not exist");
            }
            String glob = JsonUtils.text(args, "glob", null);
            Integer requested = JsonUtils.intOrNull(args, "maxResults");
            int limit = requested != null && requested > 0 ? requested : properties.getGrep().getMaxResults();
            String mode = JsonUtils.text(args, "outputMode", MODE_CONTENT);

            Search search = new Search(ctx, pattern, glob, mode, limit);
            try {
                search.run(searchPath);
            } catch (IOException e) {
                throw new ToolExecutionException("search failed: " + e.getMessage());
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("matches", search.total);
            metadata.put("truncated", search.truncated);
            if (search.lines.isEmpty()) {
                return Result.builder().title(patternText).output("No matches found.").metadata(metadata).build();
            }
            StringBuilder output = new StringBuilder();
            output.append("Found ").append(search.total).append(MODE_CONTENT.equals(mode) ? " matches" : " files").append("\n");
            for (String line : search.lines) {
                output.append(line).append("\n");
            }
            if (search.truncated) {
                output.append("\n(Results are truncated at ").append(limit)
                        .append(". Consider using a more specific path or pattern.)\n");
            }
            return Result.builder().title(patternText).output(output.toString().trim()).metadata(metadata).build();
        });
    }

    private static final class Search {
        private final Context ctx;
        private final Pattern pattern;
        private final PathMatcher globMatcher;
        private final boolean globHasDir;
        private final String mode;
        private final int limit;
        private final IgnorePatterns ignore = IgnorePatterns.defaults();
        final List<String> lines = new ArrayList<>();
        int total;
        boolean truncated;

        Search(Context ctx, Pattern pattern, String glob, String mode, int limit) {
            this.ctx = ctx;
            this.pattern = pattern;
            this.globMatcher = glob == null || glob.isBlank() ? null : FileSystems.getDefault().getPathMatcher("glob:" + glob);
            this.globHasDir = glob != null && glob.contains("/");
            this.mode = mode;
            this.limit = limit;
        }

        void run(Path start) throws IOException {
            if (Files.isRegularFile(start)) {
                searchFile(start);
                return;
            }
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(start) && ignore.ignored(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return truncated ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && attrs.size() <= MAX_FILE_BYTES && !ignore.ignored(file) && globAccepts(file)) {
                        searchFile(file);
                    }
                    return truncated ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("grep.skip file={} err={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        private boolean globAccepts(Path file) {
            if (globMatcher == null) {
                return true;
            }
            if (globHasDir) {
                return globMatcher.matches(Path.of(ToolPathResolver.relative(ctx, file)));
            }
            return globMatcher.matches(file.getFileName());
        }

        private void searchFile(Path file) {
            if (IgnorePatterns.binaryByName(file) || looksBinary(file)) {
                return;
            }
            List<String> content;
            try {
                content = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                return;
            } catch (IOException e) {
                log.debug("grep.read.failed file={} err={}", file, e.toString());
                return;
            }
            String rel = ToolPathResolver.relative(ctx, file);
            int fileMatches = 0;
            for (int i = 0; i < content.size(); i++) {
                Matcher m = pattern.matcher(content.get(i));
                if (!m.find()) {
                    continue;
                }
                fileMatches++;
                if (MODE_CONTENT.equals(mode)) {
                    if (!add(rel + ":" + (i + 1) + ": " + clip(content.get(i)))) {
                        return;
                    }
                }
            }
            if (fileMatches > 0 && !MODE_CONTENT.equals(mode)) {
                add(MODE_COUNT.equals(mode) ? rel + ":" + fileMatches : rel);
            }
        }

        private boolean add(String line) {
            if (lines.size() >= limit) {
                truncated = true;
                return false;
            }
            lines.add(line);
            total++;
            return true;
        }

        private static String clip(String line) {
            String trimmed = line.strip();
            return trimmed.length() <= MAX_LINE_CHARS ? trimmed : trimmed.substring(0, MAX_LINE_CHARS) + "...";
        }

        private static boolean looksBinary(Path file) {
            try (InputStream in = Files.newInputStream(file)) {
                byte[] head = in.readNBytes(8000);
                for (byte b : head) {
                    if (b == 0) {
                        return true;
                    }
                }
                return false;
            } catch (IOException e) {
                return true;
            }
        }
    }
}
