package work.lcod.choiceimport.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetOption;

/**
 * Reads catalog slot trees. {@code categories} may be an array of names or a map of
 * {@code name -> true}; both end up as the same lower-cased set.
 */
public final class TargetTreeReader {
    private static final int MAX_DEPTH = 64;

    private TargetTreeReader() {}

    public static List<LeveledFeatures<TargetFeatureNode>> readLeveled(JsonNode levels) {
        var result = new ArrayList<LeveledFeatures<TargetFeatureNode>>();
        if (levels == null || !levels.isArray()) {
            return result;
        }
        for (JsonNode level : levels) {
            if (!level.isObject()) {
                continue;
            }
            result.add(new LeveledFeatures<>(level.path("level").asInt(0), readFeatures(level.get("features"))));
        }
        return result;
    }

    public static List<TargetFeatureNode> readFeatures(JsonNode features) {
        return readFeatures(features, 0);
    }

    public static TargetFeatureNode readFeature(JsonNode node) {
        return readFeature(node, 0);
    }

    private static List<TargetFeatureNode> readFeatures(JsonNode features, int depth) {
        var result = new ArrayList<TargetFeatureNode>();
        if (features == null || !features.isArray() || depth > MAX_DEPTH) {
            return result;
        }
        for (JsonNode item : features) {
            if (item.isObject()) {
                result.add(readFeature(item, depth));
            }
        }
        return result;
    }

    private static TargetFeatureNode readFeature(JsonNode node, int depth) {
        return new TargetFeatureNode(
            JsonFields.text(node, "typeName"),
            JsonFields.text(node, "guid"),
            JsonFields.text(node, "name"),
            JsonFields.text(node, "description"),
            TargetFeatureNode.normalizeCategories(readCategories(node.get("categories"))),
            readOptions(node.get("options")),
            readFeatures(node.get("features"), depth + 1),
            node.path("useSubclass").asBoolean(false)
        );
    }

    static List<String> readCategories(JsonNode categories) {
        var result = new ArrayList<String>();
        if (categories == null) {
            return result;
        }
        if (categories.isArray()) {
            for (JsonNode item : categories) {
                if (item.isTextual()) {
                    result.add(item.asText());
                }
            }
        } else if (categories.isObject()) {
            var fields = categories.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (entry.getValue().asBoolean(false)) {
                    result.add(entry.getKey());
                }
            }
        }
        return result;
    }

    private static List<TargetOption> readOptions(JsonNode options) {
        var result = new ArrayList<TargetOption>();
        if (options == null || !options.isArray()) {
            return result;
        }
        for (JsonNode option : options) {
            if (option.isObject()) {
                result.add(new TargetOption(JsonFields.text(option, "name"), JsonFields.text(option, "guid")));
            }
        }
        return result;
    }
}
