package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.core.util.JsonUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ListTool: one directory level, directories first.
 */
@Component
public class ListTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .optional("path", ToolSchema.Type.STRING, "Directory to list. Defaults to the project root")
            .optionalArray("match", ToolSchema.Type.STRING, "Only keep entries whose name matches one of these globs")
            .optionalArray("ignore", ToolSchema.Type.STRING, "Extra globs to ignore, merged with the default ignore rules")
            .build();

    @Override
    public String getId() {
        return "ls";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Lists files and directories in a given path. Optionally provide glob patterns to match and ignore.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return ctx.async(() -> {
            Path dir = ToolPathResolver.resolve(ctx, JsonUtils.text(args, "path", null));
            String shown = ToolPathResolver.relative(ctx, dir);
            if (!Files.exists(dir)) {
                throw new ToolExecutionException("path '" + shown + "' does not exist");
            }
            if (!Files.isDirectory(dir)) {
                throw new ToolExecutionException("path '" + shown + "' is not a directory");
            }
            List<PathMatcher> match = globs(args.path("match"));
            IgnorePatterns ignore = IgnorePatterns.defaultsPlus(strings(args.path("ignore")));

            List<Path> entries;
            try (Stream<Path> stream = Files.list(dir)) {
                entries = stream
                        .filter(p -> match.isEmpty() || match.stream().anyMatch(m -> m.matches(p.getFileName())))
                        .filter(p -> !ignore.ignored(p))
                        .sorted(directoriesFirst())
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new ToolExecutionException("cannot list '" + shown + "': " + e.getMessage());
            }
            if (entries.isEmpty()) {
                return Result.builder().title(shown).output("No items found in " + shown + ".")
                        .metadata(Map.of("count", 0)).build();
            }
            StringBuilder out = new StringBuilder("Here's the result in ").append(shown).append(":\n```\n");
            for (Path entry : entries) {
                out.append(entry.getFileName()).append(Files.isDirectory(entry) ? "/" : "").append('\n');
            }
            out.append("```");
            return Result.builder().title(shown).output(out.toString())
                    .metadata(Map.of("count", entries.size())).build();
        });
    }

    static Comparator<Path> directoriesFirst() {
        return Comparator.<Path, Boolean>comparing(p -> !Files.isDirectory(p))
                .thenComparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT));
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            if (node.isTextual() && !node.asText().isBlank()) {
                values.add(node.asText());
            }
        }
        return values;
    }

    private static List<PathMatcher> globs(JsonNode array) {
        return strings(array).stream()
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .collect(Collectors.toList());
    }
}
