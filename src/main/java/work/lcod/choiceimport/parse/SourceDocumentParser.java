package work.lcod.choiceimport.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SelectedValue;
import work.lcod.choiceimport.model.SourceCharacter;
import work.lcod.choiceimport.model.SourceCharacter.Ancestry;
import work.lcod.choiceimport.model.SourceCharacter.Career;
import work.lcod.choiceimport.model.SourceCharacter.Characteristic;
import work.lcod.choiceimport.model.SourceCharacter.ClassSection;
import work.lcod.choiceimport.model.SourceCharacter.Culture;
import work.lcod.choiceimport.model.SourceCharacter.IncitingIncident;
import work.lcod.choiceimport.model.SourceCharacter.Reference;
import work.lcod.choiceimport.model.SourceCharacter.Subclass;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.SourceKind;

/**
 * Maps a source character document onto {@link SourceCharacter}. Only a document that is not
 * JSON, or lacks {@code name}/{@code class}, is rejected; any other section that has the wrong
 * shape is dropped and left for the importer to report.
 */
public final class SourceDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(SourceDocumentParser.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_DEPTH = 64;

    public static final List<String> CULTURE_ASPECTS = List.of("environment", "organization", "upbringing");

    private SourceDocumentParser() {}

    public static SourceCharacter parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty character document");
        }
        JsonNode root;
        try {
            root = JSON.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON character document: " + ex.getOriginalMessage(), ex);
        }
        return parse(root);
    }

    public static SourceCharacter parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Character document must be a JSON object");
        }
        var name = JsonFields.text(root, "name");
        if (name == null || name.isBlank() || !root.path("class").isObject()) {
            throw new IllegalArgumentException("Not a character document: missing name or class");
        }
        return new SourceCharacter(
            name,
            parseAncestry(root.get("ancestry")),
            parseCulture(root.get("culture")),
            parseCareer(root.get("career")),
            parseClass(root.get("class"))
        );
    }

    static Ancestry parseAncestry(JsonNode node) {
        if (!isObject(node, "ancestry")) {
            return null;
        }
        return new Ancestry(JsonFields.text(node, "name"), parseFeatures(node.get("features"), 0));
    }

    static Culture parseCulture(JsonNode node) {
        if (!isObject(node, "culture")) {
            return null;
        }
        var aspects = new LinkedHashMap<String, SourceFeatureNode>();
        for (String aspect : CULTURE_ASPECTS) {
            var aspectNode = node.get(aspect);
            if (aspectNode != null && aspectNode.isObject()) {
                aspects.put(aspect, parseFeature(aspectNode, 0));
            }
        }
        return new Culture(JsonFields.strings(node.get("languages")), aspects);
    }

    static Career parseCareer(JsonNode node) {
        if (!isObject(node, "career")) {
            return null;
        }
        IncitingIncident incident = null;
        var incidents = node.get("incitingIncidents");
        if (incidents != null && incidents.isObject()) {
            incident = new IncitingIncident(parseReferences(incidents.get("options")), JsonFields.text(incidents, "selectedID"));
        }
        return new Career(JsonFields.text(node, "name"), parseFeatures(node.get("features"), 0), incident);
    }

    static ClassSection parseClass(JsonNode node) {
        if (!isObject(node, "class")) {
            return null;
        }
        var characteristics = new ArrayList<Characteristic>();
        var rawCharacteristics = node.get("characteristics");
        if (rawCharacteristics != null && rawCharacteristics.isArray()) {
            for (JsonNode entry : rawCharacteristics) {
                var characteristic = JsonFields.text(entry, "characteristic");
                if (characteristic != null) {
                    characteristics.add(new Characteristic(characteristic, entry.path("value").asInt(0)));
                }
            }
        }
        var subclasses = new ArrayList<Subclass>();
        var rawSubclasses = node.get("subclasses");
        if (rawSubclasses != null && rawSubclasses.isArray()) {
            for (JsonNode subclass : rawSubclasses) {
                if (subclass.isObject()) {
                    subclasses.add(new Subclass(
                        JsonFields.text(subclass, "name"),
                        subclass.path("selected").asBoolean(false),
                        parseLeveled(subclass.get("featuresByLevel"), 0)
                    ));
                }
            }
        }
        return new ClassSection(
            JsonFields.text(node, "name"),
            node.path("level").asInt(1),
            characteristics,
            parseLeveled(node.get("featuresByLevel"), 0),
            parseReferences(node.get("abilities")),
            subclasses
        );
    }

    private static List<LeveledFeatures<SourceFeatureNode>> parseLeveled(JsonNode levels, int depth) {
        var result = new ArrayList<LeveledFeatures<SourceFeatureNode>>();
        if (levels == null || !levels.isArray()) {
            return result;
        }
        for (JsonNode level : levels) {
            if (level.isObject()) {
                result.add(new LeveledFeatures<>(level.path("level").asInt(0), parseFeatures(level.get("features"), depth)));
            }
        }
        return result;
    }

    private static List<SourceFeatureNode> parseFeatures(JsonNode features, int depth) {
        var result = new ArrayList<SourceFeatureNode>();
        if (features == null || !features.isArray()) {
            return result;
        }
        if (depth > MAX_DEPTH) {
            log.warn("Source features nested deeper than {} levels were dropped", MAX_DEPTH);
            return result;
        }
        for (JsonNode feature : features) {
            if (feature.isObject()) {
                result.add(parseFeature(feature, depth));
            }
        }
        return result;
    }

    private static SourceFeatureNode parseFeature(JsonNode node, int depth) {
        var type = JsonFields.text(node, "type");
        var data = node.path("data");
        return SourceFeatureNode.builder(SourceKind.from(type))
            .rawType(type)
            .id(JsonFields.text(node, "id"))
            .name(JsonFields.text(node, "name"))
            .description(JsonFields.text(node, "description"))
            .selected(parseSelected(data.get("selected"), depth + 1))
            .selectedIds(JsonFields.strings(data.get("selectedIDs")))
            .listOptions(JsonFields.strings(data.get("listOptions")))
            .children(parseFeatures(data.get("features"), depth + 1))
            .build();
    }

    private static List<SelectedValue> parseSelected(JsonNode selected, int depth) {
        var result = new ArrayList<SelectedValue>();
        if (selected == null || !selected.isArray()) {
            return result;
        }
        for (JsonNode item : selected) {
            if (item.isTextual()) {
                result.add(SelectedValue.ofName(item.asText()));
            } else if (item.isObject()) {
                SourceFeatureNode feature = null;
                if (item.has("type") || item.has("data")) {
                    feature = depth > MAX_DEPTH ? null : parseFeature(item, depth);
                }
                result.add(new SelectedValue(
                    JsonFields.text(item, "name"),
                    JsonFields.text(item, "description"),
                    JsonFields.text(item, "id"),
                    feature,
                    parseLeveled(item.get("featuresByLevel"), depth + 1)
                ));
            }
        }
        return result;
    }

    private static List<Reference> parseReferences(JsonNode array) {
        var result = new ArrayList<Reference>();
        if (array == null || !array.isArray()) {
            return result;
        }
        for (JsonNode item : array) {
            if (item.isObject()) {
                result.add(new Reference(
                    JsonFields.text(item, "id"),
                    JsonFields.text(item, "name"),
                    JsonFields.text(item, "description")
                ));
            }
        }
        return result;
    }

    private static boolean isObject(JsonNode node, String section) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (!node.isObject()) {
            log.debug("Section [{}] is not an object, ignoring it", section);
            return false;
        }
        return true;
    }
}
