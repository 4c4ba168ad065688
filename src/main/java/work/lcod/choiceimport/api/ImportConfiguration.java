package work.lcod.choiceimport.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.choiceimport.engine.ChoiceEngine;

/**
 * Immutable configuration for one character import.
 */
public record ImportConfiguration(
    Path catalogPath,
    String inputPayload,
    Optional<Integer> levelCap,
    int maxDepth,
    LogLevel logLevel,
    Map<String, String> synonyms
) {
    public ImportConfiguration {
        Objects.requireNonNull(catalogPath, "catalogPath");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(levelCap, "levelCap");
        Objects.requireNonNull(logLevel, "logLevel");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        levelCap.ifPresent(cap -> {
            if (cap < 1) {
                throw new IllegalArgumentException("levelCap must be positive: " + cap);
            }
        });
        synonyms = synonyms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(synonyms));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path catalogPath;
        private String inputPayload;
        private Optional<Integer> levelCap = Optional.empty();
        private int maxDepth = ChoiceEngine.DEFAULT_MAX_DEPTH;
        private LogLevel logLevel = LogLevel.INFO;
        private Map<String, String> synonyms = Map.of();

        public Builder catalogPath(Path catalogPath) {
            this.catalogPath = catalogPath;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder levelCap(Optional<Integer> levelCap) {
            this.levelCap = levelCap;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder synonyms(Map<String, String> synonyms) {
            this.synonyms = synonyms;
            return this;
        }

        public ImportConfiguration build() {
            return new ImportConfiguration(catalogPath, inputPayload, levelCap, maxDepth, logLevel, synonyms);
        }
    }
}
