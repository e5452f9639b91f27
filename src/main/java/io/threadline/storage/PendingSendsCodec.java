package io.threadline.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.threadline.serde.Serializer;
import io.threadline.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code pending_sends} is stored inside the checkpoint document as a list of {@code [type, base64]}
 * pairs, one per send. Two older forms are still read: the whole list under a single pair, and
 * the plain JSON list.
 */
public final class PendingSendsCodec {
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private PendingSendsCodec() {
    }

    public static ArrayNode encode(Serializer serde, List<Object> sends) {
        ArrayNode encoded = Jsons.mapper().createArrayNode();
        if (sends != null) {
            for (Object send : sends) {
                encoded.add(CheckpointDocument.encodeValue(serde, send));
            }
        }
        return encoded;
    }

    public static List<Object> decode(Serializer serde, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (isPairList(node)) {
            List<Object> sends = new ArrayList<>(node.size());
            for (JsonNode pair : node) {
                sends.add(CheckpointDocument.decodeValue(serde, pair));
            }
            return sends;
        }
        if (CheckpointDocument.isTaggedPair(node)) {
            Object decoded = CheckpointDocument.decodeValue(serde, node);
            if (decoded instanceof List<?> list) {
                return new ArrayList<>(list);
            }
            List<Object> single = new ArrayList<>();
            single.add(decoded);
            return single;
        }
        return Jsons.mapper().convertValue(node, LIST_TYPE);
    }

    private static boolean isPairList(JsonNode node) {
        if (!node.isArray()) {
            return false;
        }
        for (JsonNode element : node) {
            if (!CheckpointDocument.isTaggedPair(element)) {
                return false;
            }
        }
        return true;
    }
}
