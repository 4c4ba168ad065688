package work.lcod.choiceimport.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.choiceimport.catalog.CatalogLookup;
import work.lcod.choiceimport.catalog.JsonCatalog;
import work.lcod.choiceimport.engine.ChoiceEngine;
import work.lcod.choiceimport.importer.CharacterImporter;
import work.lcod.choiceimport.parse.SourceDocumentParser;
import work.lcod.choiceimport.shared.LogContext;
import work.lcod.choiceimport.shared.NameNormalizer;
import work.lcod.choiceimport.shared.SynonymTable;

/**
 * Public entry point for embedding the importer.
 */
public final class ImportRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Clock clock;

    public ImportRunner() {
        this(Clock.systemUTC());
    }

    public ImportRunner(Clock clock) {
        this.clock = clock;
    }

    public RunResult run(ImportConfiguration configuration) {
        var started = Instant.now(clock);
        try {
            var catalog = JsonCatalog.load(configuration.catalogPath());
            var source = SourceDocumentParser.parse(configuration.inputPayload());
            var character = importer(catalog, configuration).importCharacter(source, configuration.levelCap());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("catalog", configuration.catalogPath().toString());
            metadata.put("character", character.toMap());
            metadata.put("logLevel", configuration.logLevel().name());
            return RunResult.completed(metadata, character.issues(), started, Instant.now(clock));
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("catalog", configuration.catalogPath().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            log.debug("Import failed", ex);
            if (Boolean.getBoolean("lcod.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(ex.getMessage(), errorMeta, started, Instant.now(clock));
        }
    }

    public RunResult runToJson(ImportConfiguration configuration) {
        var result = run(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            return result.withSerializedPayload(json);
        } catch (JsonProcessingException ex) {
            return RunResult.failure("Unable to serialize result payload: " + ex.getMessage(), Map.of(), result.startedAt(), Instant.now(clock));
        }
    }

    /**
     * Wires the import pipeline over an already loaded catalog. The configured log level
     * thresholds every message the importer and engine emit.
     */
    public CharacterImporter importer(JsonCatalog catalog, ImportConfiguration configuration) {
        var synonyms = SynonymTable.loadDefault().withOverrides(configuration.synonyms());
        log.debug("Loaded {} synonyms", synonyms.size());
        var lookup = new CatalogLookup(catalog, new NameNormalizer(synonyms));
        var threshold = configuration.logLevel().slf4jLevel();
        var engine = new ChoiceEngine(lookup, clock, configuration.maxDepth(), LogContext.root(ChoiceEngine.class, threshold));
        return new CharacterImporter(lookup, catalog, engine, LogContext.root(CharacterImporter.class, threshold));
    }
}
