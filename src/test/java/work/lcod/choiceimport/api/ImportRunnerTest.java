package work.lcod.choiceimport.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.choiceimport.support.ImportTestSupport.fixture;
import static work.lcod.choiceimport.support.ImportTestSupport.readFixture;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.choiceimport.engine.ResolutionIssue;

class ImportRunnerTest {
    @Test
    void importsSampleCharacter() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("catalog.json"))
            .inputPayload(readFixture("character.json"))
            .logLevel(LogLevel.WARN)
            .build();

        var result = new ImportRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(0, result.issueCount());
        var character = (Map<?, ?>) result.metadata().get("character");
        var choices = (Map<?, ?>) character.get("levelChoices");
        assertEquals("skill-performance", choices.get("G1"));
        assertEquals("kit-mountain", character.get("kitid"));
    }

    @Test
    void issuesMakeTheRunIncompleteButNotFailed() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("catalog.json"))
            .inputPayload(readFixture("character.json"))
            .levelCap(Optional.of(1))
            .logLevel(LogLevel.ERROR)
            .build();

        var result = new ImportRunner().run(config);

        assertEquals(RunResult.Status.INCOMPLETE, result.status());
        assertEquals(0, result.status().exitCode());
        assertEquals(1, result.issueCount());
        assertTrue(result.hasIssues(ResolutionIssue.Kind.UNMATCHED_SLOT));
        assertEquals("incomplete", result.toSerializableMap().get("status"));
        assertEquals(1, result.toSerializableMap().get("issueCount"));
    }

    @Test
    void finishTimeComesFromTheRunnerClock() {
        var instant = Instant.parse("2026-01-02T03:04:05Z");
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("nowhere.json"))
            .inputPayload("{}")
            .build();

        var result = new ImportRunner(Clock.fixed(instant, ZoneOffset.UTC)).run(config);

        assertEquals(instant, result.startedAt());
        assertEquals(instant, result.finishedAt());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void synonymOverridesReachTheLookup() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("catalog.json"))
            .inputPayload(readFixture("character.json"))
            .synonyms(Map.of("Anjali", "Caelian"))
            .build();

        var character = (Map<?, ?>) new ImportRunner().run(config).metadata().get("character");
        var choices = (Map<?, ?>) character.get("levelChoices");
        assertEquals("lang-caelian", choices.get("bg-language"));
    }

    @Test
    void invalidInputBecomesFailure() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("catalog.json"))
            .inputPayload("{\"name\": \"No class\"}")
            .build();

        var result = new ImportRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(result.metadata().get("error").toString().contains("missing name or class"));
    }

    @Test
    void missingCatalogBecomesFailure() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("nowhere.json"))
            .inputPayload(readFixture("character.json"))
            .build();

        var result = new ImportRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(result.metadata().get("error").toString().startsWith("Failed to read catalog"));
    }

    @Test
    void runToJsonAttachesThePayload() {
        var config = ImportConfiguration.builder()
            .catalogPath(fixture("catalog.json"))
            .inputPayload(readFixture("character.json"))
            .build();

        var result = new ImportRunner().runToJson(config);

        var payload = result.metadata().get("payload").toString();
        assertTrue(payload.contains("\"status\" : \"success\""));
        assertTrue(payload.contains("\"G1\" : \"skill-performance\""));
    }
}
