import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerTest {
    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Analyzer.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private JsonObject outputJson() {
        return JsonParser.parseString(out.toString(StandardCharsets.UTF_8)).getAsJsonObject();
    }

    @Test
    void testUsageWithoutSourceFile() {
        assertEquals(1, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage"));
    }

    @Test
    void testMissingLanguageArgument() {
        assertEquals(1, run("-l"));
    }

    @Test
    void testUnreadableFile() {
        assertEquals(1, run(dir.resolve("missing.c").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot read"));
    }

    @Test
    void testDetectOnly() throws IOException {
        Path file = write("hello.c", "#include <stdio.h>\nint main(void) {\n    printf(\"hi\\n\");\n    return 0;\n}\n");

        assertEquals(0, run("--detect", file.toString()));
        JsonObject json = outputJson();
        assertEquals("c", json.get("language").getAsString());
        assertEquals("high", json.get("confidence").getAsString());
        assertEquals(12, json.getAsJsonObject("perLanguageScores").get("c").getAsInt());
    }

    @Test
    void testAnalyzeWithExplicitLanguage() throws IOException {
        Path file = write("a.py", "x = 1\n");

        assertEquals(0, run("-l", "python", file.toString()));
        JsonObject json = outputJson();
        assertEquals("python", json.get("language").getAsString());
        assertEquals("user-specified", json.get("confidence").getAsString());
        assertEquals(3, json.getAsJsonArray("tokens").size());
        assertEquals(0, json.getAsJsonArray("errors").size());
        JsonObject stats = json.getAsJsonObject("stats");
        assertEquals(3, stats.get("total").getAsInt());
        assertEquals(1, stats.getAsJsonObject("byKind").get("INTEGER").getAsInt());
    }

    @Test
    void testErrorsCarryMessages() throws IOException {
        Path file = write("bad.c", "\"abc");

        assertEquals(0, run("--language", "c", file.toString()));
        JsonObject error = outputJson().getAsJsonArray("errors").get(0).getAsJsonObject();
        assertEquals("ERROR", error.get("kind").getAsString());
        assertEquals("[C Error] Unterminated string literal – reached end of file", error.get("message").getAsString());
        assertEquals(1, error.get("line").getAsInt());
    }

    @Test
    void testUndetectableLanguageFails() throws IOException {
        Path file = write("notes.txt", "hello world");

        assertEquals(1, run(file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Could not auto-detect"));
    }

    @Test
    void testTokenDump() throws IOException {
        Path file = write("a.c", "int x;");

        assertEquals(0, run("-l", "c", "--tokens", file.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("1: KEYWORD int @1:1"));
    }

    @Test
    void testOutputFile() throws IOException {
        Path file = write("a.c", "int x;");
        Path target = dir.resolve("result.json");

        assertEquals(0, run("-l", "c", "-o", target.toString(), file.toString()));
        assertEquals(0, out.size());
        JsonObject json = JsonParser.parseString(Files.readString(target, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("c", json.get("language").getAsString());
    }
}
