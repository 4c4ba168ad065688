package work.lcod.choiceimport.model;

import java.util.List;
import java.util.Map;

/**
 * Typed view of a source character document. Absent or malformed sections are {@code null}.
 */
public record SourceCharacter(
    String name,
    Ancestry ancestry,
    Culture culture,
    Career career,
    ClassSection characterClass
) {
    public record Ancestry(String name, List<SourceFeatureNode> features) {
        public Ancestry {
            features = features == null ? List.of() : List.copyOf(features);
        }
    }

    public record Culture(List<String> languages, Map<String, SourceFeatureNode> aspects) {
        public Culture {
            languages = languages == null ? List.of() : List.copyOf(languages);
            aspects = aspects == null ? Map.of() : Map.copyOf(aspects);
        }
    }

    public record Career(String name, List<SourceFeatureNode> features, IncitingIncident incitingIncident) {
        public Career {
            features = features == null ? List.of() : List.copyOf(features);
        }
    }

    public record IncitingIncident(List<Reference> options, String selectedId) {
        public IncitingIncident {
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    public record ClassSection(
        String name,
        int level,
        List<Characteristic> characteristics,
        List<LeveledFeatures<SourceFeatureNode>> featuresByLevel,
        List<Reference> abilities,
        List<Subclass> subclasses
    ) {
        public ClassSection {
            characteristics = characteristics == null ? List.of() : List.copyOf(characteristics);
            featuresByLevel = featuresByLevel == null ? List.of() : List.copyOf(featuresByLevel);
            abilities = abilities == null ? List.of() : List.copyOf(abilities);
            subclasses = subclasses == null ? List.of() : List.copyOf(subclasses);
        }
    }

    public record Subclass(String name, boolean selected, List<LeveledFeatures<SourceFeatureNode>> featuresByLevel) {
        public Subclass {
            featuresByLevel = featuresByLevel == null ? List.of() : List.copyOf(featuresByLevel);
        }
    }

    public record Characteristic(String characteristic, int value) {}

    /**
     * Id/name/description triple used for abilities and inciting incident options.
     */
    public record Reference(String id, String name, String description) {}
}
