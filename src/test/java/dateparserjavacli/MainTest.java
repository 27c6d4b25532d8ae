package dateparserjavacli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private String[] lines() {
        return out.toString().trim().split("\\R");
    }

    @Test
    void translatesArguments() {
        assertEquals(0, run("translate", "-l", "en", "10 January 2015", "an hour ago"));
        assertArrayEquals(new String[]{"10 january 2015", "1 hour ago"}, lines());
    }

    @Test
    void translatesWithNormalization() {
        assertEquals(0, run("translate", "-l", "es", "--normalize", "miercoles"));
        assertEquals("wednesday", out.toString().trim());
    }

    @Test
    void searchPrintsTranslatedAndOriginal() {
        assertEquals(0, run("search", "-l", "en", "Monday. Hello world. 5 May"));
        assertArrayEquals(new String[]{"monday\tMonday", "5 may\t5 May"}, lines());
    }

    @Test
    void searchReadsInputFile(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("text.txt");
        Files.write(input, "Мы встретимся завтра.".getBytes(StandardCharsets.UTF_8));
        assertEquals(0, run("search", "-l", "ru", "-i", input.toString()));
        assertEquals("in 1 day\tзавтра", out.toString().trim());
    }

    @Test
    void checkPrintsApplicability() {
        assertEquals(0, run("check", "-l", "en", "--strip-timezone", "Monday 12:00 EST", "Montag"));
        assertArrayEquals(new String[]{"true", "false"}, lines());
    }

    @Test
    void validateReportsThroughExitCode(@TempDir Path dir) throws IOException {
        assertEquals(0, run("validate", "-l", "zh"));

        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{\"name\": \"broken\", \"monday\": [\"mon\"]}".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, run("validate", "-l", broken.toString()));
        assertTrue(out.toString().contains("broken: invalid"));
    }

    @Test
    void infoPrintsJson() throws IOException {
        assertEquals(0, run("info", "-l", "ru"));
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertEquals("ru", root.get("name").asText());
        assertEquals(7, root.get("weekdays").size());
        assertEquals(12, root.get("months").size());
        assertEquals("января", root.get("months").get(0).get(1).asText());
    }

    @Test
    void infoFailsOnIncompleteLanguage(@TempDir Path dir) throws IOException {
        Path partial = dir.resolve("partial.json");
        Files.write(partial, "{\"name\": \"partial\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, run("info", "-l", partial.toString()));
        assertTrue(err.toString().contains("partial"));
    }

    @Test
    void unknownLanguageFails() {
        assertEquals(1, run("translate", "-l", "xx-unknown", "foo"));
        assertTrue(err.toString().contains("Unknown language"));
    }

    @Test
    void missingLanguageOptionIsAUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("translate", "foo"));
    }
}
