package work.lcod.choiceimport.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

final class JsonFields {
    private JsonFields() {}

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    static List<String> strings(JsonNode array) {
        var result = new ArrayList<String>();
        if (array == null || !array.isArray()) {
            return result;
        }
        for (JsonNode item : array) {
            if (item.isValueNode() && !item.isNull()) {
                result.add(item.asText());
            }
        }
        return result;
    }
}
