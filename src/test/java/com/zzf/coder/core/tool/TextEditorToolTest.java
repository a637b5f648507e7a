package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextEditorToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TextEditorTool tool = new TextEditorTool();

    @TempDir
    Path root;

    @Test
    void shouldViewWithLineNumbersAndRange() throws Exception {
        Files.writeString(root.resolve("a.txt"), "one\ntwo\nthree\n");

        String all = run(command("view", "a.txt")).getOutput();
        ObjectNode ranged = command("view", "a.txt");
        ranged.putArray("view_range").add(2).add(-1);
        String tail = run(ranged).getOutput();

        assertTrue(all.contains("     1\tone"), all);
        assertTrue(all.contains("     3\tthree"), all);
        assertTrue(tail.contains("     2\ttwo"), tail);
        assertTrue(!tail.contains("\tone"), tail);
    }

    @Test
    void shouldRejectInvalidViewRange() throws Exception {
        Files.writeString(root.resolve("a.txt"), "one\ntwo\n");
        ObjectNode args = command("view", "a.txt");
        args.putArray("view_range").add(3).add(1);

        assertTrue(failure(args).startsWith("invalid view_range"));
    }

    @Test
    void shouldCreateFilesWithParentDirectories() throws Exception {
        ObjectNode args = command("create", "pkg/new/File.java").put("file_text", "class File {}\n");

        Tool.Result result = run(args);

        assertEquals("File created: pkg/new/File.java", result.getOutput());
        assertEquals("class File {}\n", Files.readString(root.resolve("pkg/new/File.java")));
    }

    @Test
    void shouldReplaceUniqueAnchor() throws Exception {
        Path file = root.resolve("Main.java");
        Files.writeString(file, "int a = 1;\nint b = 2;\n");

        run(command("str_replace", "Main.java").put("old_str", "int b = 2;").put("new_str", "int b = 3;"));

        assertEquals("int a = 1;\nint b = 3;\n", Files.readString(file));
    }

    @Test
    void shouldMatchAnchorIgnoringIndentation() throws Exception {
        Path file = root.resolve("Main.java");
        Files.writeString(file, "class A {\n    void run() {\n    }\n}\n");

        run(command("str_replace", "Main.java").put("old_str", "void run() {\n}").put("new_str", "    void go() {\n    }"));

        assertEquals("class A {\n    void go() {\n    }\n}\n", Files.readString(file));
    }

    @Test
    void shouldEditTheLineThatMatchedIgnoringWhitespace() throws Exception {
        Path file = root.resolve("calls.txt");
        Files.writeString(file, "x  foo();\n  foo();\n");

        run(command("str_replace", "calls.txt").put("old_str", "foo();\t").put("new_str", "  bar();"));

        assertEquals("x  foo();\n  bar();\n", Files.readString(file));
    }

    @Test
    void shouldReplaceAllWhitespaceInsensitiveMatchesOnly() throws Exception {
        Path file = root.resolve("calls.txt");
        Files.writeString(file, "  foo();\nx  foo();\n\tfoo();\n");

        Tool.Result result = run(command("str_replace", "calls.txt")
                .put("old_str", " foo(); ").put("new_str", "bar();").put("replace_all", true));

        assertEquals("bar();\nx  foo();\nbar();\n", Files.readString(file));
        assertEquals(2, result.getMetadata().get("occurrences"));
    }

    @Test
    void shouldReportAmbiguousAndMissingAnchors() throws Exception {
        Files.writeString(root.resolve("dup.txt"), "x = 1\nx = 1\n");

        String ambiguous = failure(command("str_replace", "dup.txt").put("old_str", "x = 1").put("new_str", "y"));
        String missing = failure(command("str_replace", "dup.txt").put("old_str", "z = 9").put("new_str", "y"));

        assertTrue(ambiguous.startsWith("anchor text matches 2 locations in dup.txt"), ambiguous);
        assertTrue(missing.startsWith("anchor text not found in dup.txt"), missing);
    }

    @Test
    void shouldReplaceAllWhenAsked() throws Exception {
        Path file = root.resolve("dup.txt");
        Files.writeString(file, "x = 1\nx = 1\n");

        Tool.Result result = run(command("str_replace", "dup.txt").put("old_str", "x = 1").put("new_str", "y").put("replace_all", true));

        assertEquals("y\ny\n", Files.readString(file));
        assertEquals(2, result.getMetadata().get("occurrences"));
    }

    @Test
    void shouldInsertAfterLine() throws Exception {
        Path file = root.resolve("list.txt");
        Files.writeString(file, "a\nc\n");

        run(command("insert", "list.txt").put("insert_line", 1).put("new_str", "b"));
        run(command("insert", "list.txt").put("insert_line", 0).put("new_str", "start"));

        assertEquals("start\na\nb\nc\n", Files.readString(file));
        assertEquals("insert_line 9 out of range [0, 4]",
                failure(command("insert", "list.txt").put("insert_line", 9).put("new_str", "x")));
    }

    @Test
    void shouldKeepCrlfLineEndingsOnInsert() throws Exception {
        Path file = root.resolve("win.txt");
        Files.writeString(file, "a\r\nc\r\n");

        run(command("insert", "win.txt").put("insert_line", 1).put("new_str", "b"));

        assertEquals("a\r\nb\r\nc\r\n", Files.readString(file));
    }

    @Test
    void shouldRejectMissingFilesDirectoriesAndEscapes() throws Exception {
        Files.createDirectories(root.resolve("dir"));

        assertEquals("file does not exist: nope.txt", failure(command("view", "nope.txt")));
        assertEquals("path is a directory: dir", failure(command("view", "dir")));
        assertTrue(failure(command("view", "../outside.txt")).contains("outside the project root"));
    }

    @Test
    void shouldSplitLinesWithoutTrailingEmptyLine() {
        assertEquals(List.of("a", "b"), TextEditorTool.splitLines("a\nb\n"));
        assertEquals(List.of("a", "", "b"), TextEditorTool.splitLines("a\n\nb"));
        assertEquals(List.of("a", "b"), TextEditorTool.splitLines("a\r\nb\r\n"));
        assertTrue(TextEditorTool.splitLines("").isEmpty());
        assertEquals("\r\n", TextEditorTool.lineSeparator("a\r\nb"));
        assertEquals("\n", TextEditorTool.lineSeparator("a\nb"));
    }

    private ObjectNode command(String command, String path) {
        return mapper.createObjectNode().put("command", command).put("path", path);
    }

    private Tool.Result run(ObjectNode args) throws Exception {
        return tool.execute(args, Tool.Context.builder().projectRoot(root).build()).get(10, TimeUnit.SECONDS);
    }

    private String failure(ObjectNode args) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> run(args));
        assertInstanceOf(ToolExecutionException.class, error.getCause());
        return error.getCause().getMessage();
    }
}
