package io.threadline.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.threadline.model.Checkpoint;
import io.threadline.serde.SerializationException;
import io.threadline.serde.Serializer;
import io.threadline.serde.TypedValue;
import io.threadline.util.Jsons;

import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON document form of a checkpoint. Channel values and pending sends go through the serializer
 * one by one as {@code [type, base64]} pairs; the remaining fields are plain JSON.
 */
public final class CheckpointDocument {
    static final String CHANNEL_VALUES = "channel_values";
    static final String PENDING_SENDS = "pending_sends";

    private CheckpointDocument() {
    }

    /** @param withValues {@code false} leaves {@code channel_values} out, for stores that keep them elsewhere */
    public static ObjectNode encode(Serializer serde, Checkpoint checkpoint, boolean withValues) {
        ObjectNode document = Jsons.mapper().valueToTree(
                checkpoint.withChannelValues(Map.of()).withPendingSends(List.of()));
        document.remove(CHANNEL_VALUES);
        if (withValues) {
            ObjectNode values = document.putObject(CHANNEL_VALUES);
            for (Map.Entry<String, Object> e : checkpoint.channelValues().entrySet()) {
                values.set(e.getKey(), encodeValue(serde, e.getValue()));
            }
        }
        document.set(PENDING_SENDS, PendingSendsCodec.encode(serde, checkpoint.pendingSends()));
        return document;
    }

    /** Decodes {@code channel_values} from the document itself. */
    public static Checkpoint decode(Serializer serde, ObjectNode document) {
        return decode(serde, document, null);
    }

    /**
     * @param channelValues values loaded from elsewhere, or {@code null} to decode the document's own
     */
    public static Checkpoint decode(Serializer serde, ObjectNode document, Map<String, Object> channelValues) {
        ObjectNode copy = document.deepCopy();
        List<Object> pendingSends = PendingSendsCodec.decode(serde, copy.remove(PENDING_SENDS));
        JsonNode encoded = copy.remove(CHANNEL_VALUES);
        Map<String, Object> values = channelValues != null ? channelValues : decodeValues(serde, encoded);
        return Jsons.mapper().convertValue(copy, Checkpoint.class)
                .withChannelValues(values)
                .withPendingSends(pendingSends);
    }

    /** Serializes one value on its own, so {@code byte[]} keeps its tag. */
    public static ArrayNode encodeValue(Serializer serde, Object value) {
        TypedValue typed = serde.dumps(value);
        ArrayNode pair = Jsons.mapper().createArrayNode();
        pair.add(typed.type());
        pair.add(Base64.getEncoder().encodeToString(typed.data()));
        return pair;
    }

    public static Object decodeValue(Serializer serde, JsonNode pair) {
        if (!isTaggedPair(pair)) {
            throw new SerializationException("Expected a [type, base64] pair but found " + pair);
        }
        return serde.loads(new TypedValue(pair.get(0).asText(), Base64.getDecoder().decode(pair.get(1).asText())));
    }

    static boolean isTaggedPair(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2
                || !node.get(0).isTextual() || !node.get(1).isTextual()) {
            return false;
        }
        String type = node.get(0).asText();
        if (!TypedValue.JSON.equals(type) && !TypedValue.BYTES.equals(type)) {
            return false;
        }
        try {
            Base64.getDecoder().decode(node.get(1).asText());
            return true;
        } catch (IllegalArgumentException notBase64) {
            return false;
        }
    }

    private static Map<String, Object> decodeValues(Serializer serde, JsonNode encoded) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (encoded == null || encoded.isNull()) {
            return values;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = encoded.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), decodeValue(serde, field.getValue()));
        }
        return values;
    }
}
