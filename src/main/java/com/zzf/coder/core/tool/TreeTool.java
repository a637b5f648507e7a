package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.core.util.JsonUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TreeTool: box-drawing directory tree, directories before files.
 */
@Component
public class TreeTool implements Tool {
    static final int DEFAULT_MAX_DEPTH = 3;

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .optional("path", ToolSchema.Type.STRING, "Directory to display. Defaults to the project root")
            .optional("maxDepth", ToolSchema.Type.INTEGER, "Maximum depth to traverse, at most 3 is recommended. Defaults to 3")
            .build();

    @Override
    public String getId() {
        return "tree";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Displays the directory structure as a tree, excluding version control, dependencies and build outputs.");
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
            Integer requested = JsonUtils.intOrNull(args, "maxDepth");
            int maxDepth = requested != null && requested > 0 ? requested : DEFAULT_MAX_DEPTH;

            List<String> treeLines = new ArrayList<>();
            int[] counts = new int[2];
            walk(dir, "", 0, maxDepth, IgnorePatterns.defaults(), treeLines, counts);

            StringBuilder out = new StringBuilder("Here's the result in ").append(shown).append(":\n\n```\n");
            out.append(shown).append("/\n");
            for (String line : treeLines) {
                out.append(line).append('\n');
            }
            out.append('\n').append(counts[0]).append(" directories, ").append(counts[1]).append(" files\n```");

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("directories", counts[0]);
            metadata.put("files", counts[1]);
            return Result.builder().title(shown).output(out.toString()).metadata(metadata).build();
        });
    }

    private void walk(Path dir, String prefix, int depth, int maxDepth, IgnorePatterns ignore,
                      List<String> lines, int[] counts) {
        if (depth >= maxDepth) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.list(dir)) {
            entries = stream.filter(p -> !ignore.ignored(p))
                    .sorted(ListTool.directoriesFirst())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            lines.add(prefix + "[Permission Denied]");
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            Path entry = entries.get(i);
            boolean last = i == entries.size() - 1;
            String connector = last ? "└── " : "├── ";
            if (Files.isDirectory(entry)) {
                counts[0]++;
                lines.add(prefix + connector + entry.getFileName() + "/");
                walk(entry, prefix + (last ? "    " : "│   "), depth + 1, maxDepth, ignore, lines, counts);
            } else {
                counts[1]++;
                lines.add(prefix + connector + entry.getFileName());
            }
        }
    }
}
