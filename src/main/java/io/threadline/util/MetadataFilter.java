package io.threadline.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Subset containment over metadata, following the PostgreSQL {@code jsonb @>} rules: objects
 * match when every filter field is contained in the same field, arrays when every filter element
 * is contained in some element, scalars when equal.
 */
public final class MetadataFilter {
    private MetadataFilter() {
    }

    public static boolean matches(Map<String, Object> metadata, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (metadata == null) {
            return false;
        }
        return contains(Jsons.mapper().valueToTree(metadata), Jsons.mapper().valueToTree(filter));
    }

    static boolean contains(JsonNode target, JsonNode filter) {
        if (filter.isObject()) {
            if (!target.isObject()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = filter.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode candidate = target.get(field.getKey());
                if (candidate == null || !contains(candidate, field.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (filter.isArray()) {
            if (!target.isArray()) {
                return false;
            }
            for (JsonNode wanted : filter) {
                boolean found = false;
                for (JsonNode element : target) {
                    if (contains(element, wanted)) {
                        found = true;
                        break;
                    }
                }
                if (!found) {
                    return false;
                }
            }
            return true;
        }
        if (filter.isNumber() && target.isNumber()) {
            return filter.decimalValue().compareTo(target.decimalValue()) == 0;
        }
        return filter.equals(target);
    }
}
