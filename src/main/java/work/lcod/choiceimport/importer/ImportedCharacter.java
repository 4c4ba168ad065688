package work.lcod.choiceimport.importer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.choiceimport.engine.ResolutionIssue;

/**
 * Everything an import produced for one character: looked-up catalog ids per section, the merged
 * level choices and the issues met on the way.
 */
public record ImportedCharacter(
    String name,
    Map<String, Integer> attributes,
    Map<String, String> lookups,
    int classLevel,
    List<String> kitIds,
    Map<String, Object> levelChoices,
    List<ResolutionIssue> issues
) {
    public static final String RACE = "race";
    public static final String LANGUAGE = "language";
    public static final String BACKGROUND = "background";
    public static final String INCITING_INCIDENT = "incitingIncident";
    public static final String CLASS = "class";
    public static final String SUBCLASS = "subclass";

    public ImportedCharacter {
        Objects.requireNonNull(name, "name");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        lookups = Collections.unmodifiableMap(new LinkedHashMap<>(lookups));
        kitIds = List.copyOf(kitIds);
        levelChoices = Collections.unmodifiableMap(new LinkedHashMap<>(levelChoices));
        issues = List.copyOf(issues);
    }

    public Optional<String> lookup(String key) {
        return Optional.ofNullable(lookups.get(key));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("attributes", attributes);
        map.put("lookups", lookups);
        map.put("classLevel", classLevel);
        for (int i = 0; i < kitIds.size(); i++) {
            map.put(i == 0 ? "kitid" : "kitid" + (i + 1), kitIds.get(i));
        }
        map.put("levelChoices", levelChoices);
        map.put("issues", issues.stream().map(ResolutionIssue::toMap).toList());
        return map;
    }

    static Builder builder(String name) {
        return new Builder(name);
    }

    static final class Builder {
        private final String name;
        private final Map<String, Integer> attributes = new LinkedHashMap<>();
        private final Map<String, String> lookups = new LinkedHashMap<>();
        private final List<String> kitIds = new ArrayList<>();
        private int classLevel;

        private Builder(String name) {
            this.name = name;
        }

        Builder attribute(String key, int value) {
            attributes.put(key, value);
            return this;
        }

        Builder lookup(String key, String id) {
            lookups.put(key, id);
            return this;
        }

        Builder classLevel(int classLevel) {
            this.classLevel = classLevel;
            return this;
        }

        Builder kit(String kitId) {
            kitIds.add(kitId);
            return this;
        }

        int kitCount() {
            return kitIds.size();
        }

        ImportedCharacter build(Map<String, Object> levelChoices, List<ResolutionIssue> issues) {
            return new ImportedCharacter(name, attributes, lookups, classLevel, kitIds, levelChoices, issues);
        }
    }
}
