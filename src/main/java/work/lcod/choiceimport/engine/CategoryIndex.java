package work.lcod.choiceimport.engine;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetType;

/**
 * Category key to slot guid for every slot of one type, walking the whole tree.
 */
public final class CategoryIndex {
    private CategoryIndex() {}

    public static Map<String, String> build(List<LeveledFeatures<TargetFeatureNode>> levels, TargetType type) {
        var index = new LinkedHashMap<String, String>();
        for (var level : levels) {
            collect(level.features(), type, index, 0);
        }
        return index;
    }

    /**
     * Sorted, lower-cased, comma-joined category list; empty for an uncategorised slot.
     */
    public static String key(Collection<String> categories) {
        return String.join(",", TargetFeatureNode.normalizeCategories(categories).stream().sorted().toList());
    }

    private static void collect(List<TargetFeatureNode> nodes, TargetType type, Map<String, String> index, int depth) {
        if (depth > ChoiceEngine.DEFAULT_MAX_DEPTH) {
            return;
        }
        for (TargetFeatureNode node : nodes) {
            if (node.is(type) && node.guid() != null) {
                index.put(key(node.categories()), node.guid());
            }
            collect(node.children(), type, index, depth + 1);
        }
    }
}
