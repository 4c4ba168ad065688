package work.lcod.choiceimport.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only node of an expanded catalog feature tree. Categories are stored lower-cased.
 */
public record TargetFeatureNode(
    String typeName,
    String guid,
    String name,
    String description,
    Set<String> categories,
    List<TargetOption> options,
    List<TargetFeatureNode> children,
    boolean useSubclass
) {
    public TargetFeatureNode {
        categories = normalizeCategories(categories);
        options = options == null ? List.of() : List.copyOf(options);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public TargetType type() {
        return TargetType.fromTypeName(typeName);
    }

    public boolean is(TargetType type) {
        return type() == type;
    }

    public String label() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return guid == null ? "unnamed" : guid;
    }

    public static Set<String> normalizeCategories(Collection<String> raw) {
        var normalized = new TreeSet<String>();
        if (raw != null) {
            for (String category : raw) {
                if (category != null && !category.isBlank()) {
                    normalized.add(category.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Set.copyOf(normalized);
    }
}
