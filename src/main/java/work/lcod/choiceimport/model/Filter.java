package work.lcod.choiceimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prefix predicate on target node fields ({@code name}, {@code description}). An empty filter
 * accepts everything.
 */
public record Filter(Map<String, String> prefixes) {
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";

    private static final Filter NONE = new Filter(Map.of());

    public Filter {
        prefixes = prefixes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
    }

    public static Filter none() {
        return NONE;
    }

    public static Filter byName(String prefix) {
        return new Filter(Map.of(NAME, prefix));
    }

    public static Filter byDescription(String prefix) {
        return new Filter(Map.of(DESCRIPTION, prefix));
    }

    public boolean isEmpty() {
        return prefixes.isEmpty();
    }

    public String fieldValue(TargetFeatureNode node, String field) {
        return switch (field) {
            case NAME -> node.name();
            case DESCRIPTION -> node.description();
            default -> null;
        };
    }

    @Override
    public String toString() {
        return prefixes.toString();
    }
}
