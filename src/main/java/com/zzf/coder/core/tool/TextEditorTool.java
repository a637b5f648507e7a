package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * TextEditorTool: view, create, str_replace and insert on files under the project root.
 */
@Component
@Slf4j
public class TextEditorTool implements Tool {
    static final String VIEW = "view";
    static final String CREATE = "create";
    static final String STR_REPLACE = "str_replace";
    static final String INSERT = "insert";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .requiredEnum("command", "The command to run", List.of(VIEW, CREATE, STR_REPLACE, INSERT))
            .required("path", ToolSchema.Type.STRING, "File path, relative to the project root or absolute inside it")
            .optional("file_text", ToolSchema.Type.STRING, "Content of the file to create (create)")
            .optionalArray("view_range", ToolSchema.Type.INTEGER, "[start, end] 1-based line range; end -1 reads to the end (view)")
            .optional("old_str", ToolSchema.Type.STRING, "Text to replace; must identify a single location unless replace_all is set (str_replace)")
            .optional("new_str", ToolSchema.Type.STRING, "Replacement text (str_replace) or text to insert (insert)")
            .optional("insert_line", ToolSchema.Type.INTEGER, "Line after which to insert; 0 inserts at the top (insert)")
            .optional("replace_all", ToolSchema.Type.BOOLEAN, "Replace every occurrence of old_str (str_replace)")
            .build();

    @Override
    public String getId() {
        return "text_editor";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Views, creates and edits text files. Use view before editing and give old_str enough context to be unique.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return ctx.async(() -> {
            String command = JsonUtils.text(args, "command", "");
            Path path = ToolPathResolver.resolve(ctx, JsonUtils.text(args, "path", ""));
            String shown = ToolPathResolver.relative(ctx, path);
            try {
                switch (command) {
                    case VIEW:
                        return view(path, shown, args.path("view_range"));
                    case CREATE:
                        return create(path, shown, args);
                    case STR_REPLACE:
                        return strReplace(path, shown, args);
                    case INSERT:
                        return insert(path, shown, args);
                    default:
                        throw new ToolExecutionException("unknown command '" + command + "'");
                }
            } catch (IOException e) {
                throw new ToolExecutionException("I/O error on " + shown + ": " + e.getMessage());
            }
        });
    }

    private Result view(Path path, String shown, JsonNode range) throws IOException {
        requireFile(path, shown);
        String content = Files.readString(path, StandardCharsets.UTF_8);
        List<String> lines = splitLines(content);
        int start = 1;
        int end = lines.size();
        if (range != null && !range.isMissingNode() && !range.isNull()) {
            if (range.size() != 2 || !range.get(0).isIntegralNumber() || !range.get(1).isIntegralNumber()) {
                throw new ToolExecutionException("invalid view_range: expected two integers [start, end]");
            }
            start = range.get(0).asInt();
            int requestedEnd = range.get(1).asInt();
            if (start < 1 || start > Math.max(1, lines.size())) {
                throw new ToolExecutionException("invalid view_range " + range + ": start line " + start
                        + " must be within [1, " + lines.size() + "]");
            }
            if (requestedEnd != -1 && requestedEnd < start) {
                throw new ToolExecutionException("invalid view_range " + range + ": end line " + requestedEnd
                        + " must be -1 or >= " + start);
            }
            end = requestedEnd == -1 ? lines.size() : Math.min(requestedEnd, lines.size());
        }
        StringBuilder out = new StringBuilder("Here's the content of ").append(shown).append(":\n");
        for (int i = start; i <= end; i++) {
            out.append(String.format("%6d\t%s", i, lines.get(i - 1))).append('\n');
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("path", shown);
        metadata.put("totalLines", lines.size());
        return Result.builder().title(shown).output(out.toString()).metadata(metadata).build();
    }

    private Result create(Path path, String shown, JsonNode args) throws IOException {
        if (Files.isDirectory(path)) {
            throw new ToolExecutionException("path is a directory: " + shown);
        }
        JsonNode text = args.get("file_text");
        if (text == null || text.isNull()) {
            throw new ToolExecutionException("file_text is required for create");
        }
        boolean existed = Files.exists(path);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, text.asText(), StandardCharsets.UTF_8);
        log.info("editor.create path={} overwritten={}", shown, existed);
        return Result.builder().title(shown)
                .output((existed ? "File overwritten: " : "File created: ") + shown)
                .metadata(Map.of("path", shown, "created", !existed))
                .build();
    }

    private Result strReplace(Path path, String shown, JsonNode args) throws IOException {
        requireFile(path, shown);
        JsonNode oldNode = args.get("old_str");
        if (oldNode == null || oldNode.isNull() || oldNode.asText().isEmpty()) {
            throw new ToolExecutionException("old_str is required for str_replace");
        }
        String oldStr = oldNode.asText();
        String newStr = JsonUtils.text(args, "new_str", "");
        boolean replaceAll = args.path("replace_all").asBoolean(false);
        String content = Files.readString(path, StandardCharsets.UTF_8);

        List<int[]> matches = findExactMatches(content, oldStr);
        if (matches.isEmpty()) {
            matches = findTrimmedMatches(content, oldStr);
        }
        if (matches.isEmpty()) {
            throw new ToolExecutionException("anchor text not found in " + shown
                    + ". Use view to check the exact current content");
        }
        if (matches.size() > 1 && !replaceAll) {
            throw new ToolExecutionException("anchor text matches " + matches.size() + " locations in " + shown
                    + ". Provide more surrounding context to identify one, or set replace_all");
        }

        // splice from the end so earlier offsets stay valid
        StringBuilder updatedText = new StringBuilder(content);
        for (int i = matches.size() - 1; i >= 0; i--) {
            int[] region = matches.get(i);
            updatedText.replace(region[0], region[1], newStr);
        }
        String updated = updatedText.toString();
        Files.writeString(path, updated, StandardCharsets.UTF_8);
        log.info("editor.replace path={} occurrences={}", shown, matches.size());
        return Result.builder().title(shown)
                .output("Successfully replaced " + matches.size() + " occurrence" + (matches.size() == 1 ? "" : "s") + " in " + shown + ".")
                .metadata(Map.of("path", shown, "occurrences", matches.size()))
                .build();
    }

    private Result insert(Path path, String shown, JsonNode args) throws IOException {
        requireFile(path, shown);
        JsonNode lineNode = args.get("insert_line");
        if (lineNode == null || !lineNode.isIntegralNumber()) {
            throw new ToolExecutionException("insert_line is required for insert");
        }
        JsonNode newNode = args.get("new_str");
        if (newNode == null || newNode.isNull()) {
            throw new ToolExecutionException("new_str is required for insert");
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        String separator = lineSeparator(content);
        List<String> lines = splitLines(content);
        int insertLine = lineNode.asInt();
        if (insertLine < 0 || insertLine > lines.size()) {
            throw new ToolExecutionException("insert_line " + insertLine + " out of range [0, " + lines.size() + "]");
        }
        List<String> inserted = splitLines(newNode.asText());
        lines.addAll(insertLine, inserted.isEmpty() ? List.of("") : inserted);
        String updated = String.join(separator, lines) + (content.endsWith("\n") || content.isEmpty() ? separator : "");
        Files.writeString(path, updated, StandardCharsets.UTF_8);
        return Result.builder().title(shown)
                .output("Inserted text after line " + insertLine + " in " + shown + ".")
                .metadata(Map.of("path", shown, "insertLine", insertLine))
                .build();
    }

    private static void requireFile(Path path, String shown) {
        if (!Files.exists(path)) {
            throw new ToolExecutionException("file does not exist: " + shown);
        }
        if (Files.isDirectory(path)) {
            throw new ToolExecutionException("path is a directory: " + shown);
        }
    }

    /** Lines without terminators; a trailing newline does not produce an extra empty line. */
    static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return new ArrayList<>();
        }
        String body = content;
        if (body.endsWith("\r\n")) {
            body = body.substring(0, body.length() - 2);
        } else if (body.endsWith("\n")) {
            body = body.substring(0, body.length() - 1);
        }
        return new ArrayList<>(Arrays.asList(body.split("\r?\n", -1)));
    }

    /** CRLF when the file's first line break is one, LF otherwise. */
    static String lineSeparator(String content) {
        int lf = content.indexOf('\n');
        return lf > 0 && content.charAt(lf - 1) == '\r' ? "\r\n" : "\n";
    }

    /** Non-overlapping {start, end} offsets of {@code needle}. */
    static List<int[]> findExactMatches(String content, String needle) {
        List<int[]> regions = new ArrayList<>();
        int from = 0;
        while ((from = content.indexOf(needle, from)) >= 0) {
            regions.add(new int[]{from, from + needle.length()});
            from += needle.length();
        }
        return regions;
    }

    /**
     * Line-wise match ignoring leading and trailing whitespace on each line.
     * Returns the {start, end} offsets of each matched run of whole lines in {@code content};
     * the end excludes the terminator of the last matched line.
     */
    static List<int[]> findTrimmedMatches(String content, String find) {
        List<int[]> results = new ArrayList<>();
        String[] originalLines = content.split("\n", -1);
        List<String> searchLines = new ArrayList<>(List.of(find.split("\n", -1)));
        if (!searchLines.isEmpty() && searchLines.get(searchLines.size() - 1).trim().isEmpty()) {
            searchLines.remove(searchLines.size() - 1);
        }
        if (searchLines.isEmpty()) {
            return results;
        }
        int[] lineStarts = new int[originalLines.length];
        for (int k = 1; k < originalLines.length; k++) {
            lineStarts[k] = lineStarts[k - 1] + originalLines[k - 1].length() + 1;
        }
        int i = 0;
        while (i <= originalLines.length - searchLines.size()) {
            boolean matches = true;
            for (int j = 0; j < searchLines.size(); j++) {
                if (!originalLines[i + j].trim().equals(searchLines.get(j).trim())) {
                    matches = false;
                    break;
                }
            }
            if (!matches) {
                i++;
                continue;
            }
            int last = i + searchLines.size() - 1;
            int end = lineStarts[last] + originalLines[last].length();
            if (originalLines[last].endsWith("\r")) {
                end--;
            }
            results.add(new int[]{lineStarts[i], end});
            // matched regions never overlap
            i += searchLines.size();
        }
        return results;
    }
}
