package work.lcod.choiceimport.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.choiceimport.support.ImportTestSupport.fixture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
        System.clearProperty(ImportCommand.SIMPLE_LOGGER_LEVEL);
    }

    @Test
    void printsTheRunResultAsJson() throws Exception {
        int exit = Main.execute("--catalog", fixture("catalog.json").toString(), "--input", fixture("character.json").toString(), "--log-level", "warn");

        assertEquals(0, exit);
        var result = output();
        assertEquals("success", result.path("status").asText());
        assertEquals("skill-performance", result.path("metadata").path("character").path("levelChoices").path("G1").asText());
        assertEquals("warn", System.getProperty(ImportCommand.SIMPLE_LOGGER_LEVEL));
    }

    @Test
    void configFileAppliesUnlessFlagsOverride() throws Exception {
        var catalog = fixture("catalog.json").toString();
        var input = fixture("character.json").toString();
        var config = fixture("import.toml").toString();

        assertEquals(0, Main.execute("-c", catalog, "-i", input, "--config", config));
        var capped = output();
        assertEquals("incomplete", capped.path("status").asText());
        assertEquals(1, capped.path("issueCount").asInt());
        assertEquals("WARN", capped.path("metadata").path("logLevel").asText());

        out.reset();
        assertEquals(0, Main.execute("-c", catalog, "-i", input, "--config", config, "--level-cap", "2", "--log-level", "error"));
        var uncapped = output();
        assertEquals("success", uncapped.path("status").asText());
        assertEquals(0, uncapped.path("issueCount").asInt());
        assertEquals("ERROR", uncapped.path("metadata").path("logLevel").asText());
    }

    @Test
    void unreadableCharacterIsAFailedRun(@TempDir Path dir) throws Exception {
        var input = dir.resolve("broken.json");
        Files.writeString(input, "{\"name\": \"Half\"}");

        int exit = Main.execute("--catalog", fixture("catalog.json").toString(), "--input", input.toString());

        assertEquals(1, exit);
        assertEquals("failure", output().path("status").asText());
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, Main.execute("--input", fixture("character.json").toString()));
        assertEquals(2, Main.execute("--catalog", fixture("catalog.json").toString(), "--input", fixture("absent.json").toString()));
        assertEquals(2, Main.execute("--catalog", fixture("catalog.json").toString(), "--input", fixture("character.json").toString(), "--log-level", "loud"));
    }

    @Test
    void helpAndVersionSucceed() {
        assertEquals(0, Main.execute("--help"));
        assertEquals(0, Main.execute("--version"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("lcod-choice-import"));
    }

    private JsonNode output() throws Exception {
        return JSON.readTree(out.toString(StandardCharsets.UTF_8));
    }
}
