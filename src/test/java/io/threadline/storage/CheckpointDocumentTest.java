package io.threadline.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.threadline.model.Checkpoint;
import io.threadline.serde.JsonPlusSerializer;
import io.threadline.serde.SerializationException;
import io.threadline.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class CheckpointDocumentTest {
    private final JsonPlusSerializer serde = new JsonPlusSerializer();

    @Test
    void channelValuesAreTaggedPerChannel() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("raw", new byte[]{1, 2, 3});
        values.put("messages", List.of("hi"));
        values.put("nothing", null);
        Checkpoint checkpoint = new Checkpoint(Checkpoint.FORMAT_VERSION, "c1", "2024-05-01T12:00:00Z", values,
                Map.of("raw", "00000000000000000000000000000001."), Map.of("node", Map.of("raw", "00000000000000000000000000000001.")),
                List.of());

        ObjectNode document = CheckpointDocument.encode(serde, checkpoint, true);
        Assertions.assertEquals("bytes", document.get("channel_values").get("raw").get(0).asText());
        Assertions.assertEquals("json", document.get("channel_values").get("messages").get(0).asText());

        Checkpoint decoded = CheckpointDocument.decode(serde, (ObjectNode) Jsons.readTree(document.toString()));
        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) decoded.channelValues().get("raw"));
        Assertions.assertEquals(List.of("hi"), decoded.channelValues().get("messages"));
        Assertions.assertTrue(decoded.channelValues().containsKey("nothing"));
        Assertions.assertNull(decoded.channelValues().get("nothing"));
        Assertions.assertEquals(checkpoint.versionsSeen(), decoded.versionsSeen());
        Assertions.assertEquals("c1", decoded.id());
    }

    @Test
    void valuesCanLiveOutsideTheDocument() {
        Checkpoint checkpoint = new Checkpoint(Checkpoint.FORMAT_VERSION, "c1", "2024-05-01T12:00:00Z",
                Map.of("topic", "weather"), Map.of(), Map.of(), List.of());
        ObjectNode document = CheckpointDocument.encode(serde, checkpoint, false);
        Assertions.assertFalse(document.has("channel_values"));

        Checkpoint decoded = CheckpointDocument.decode(serde, document, Map.of("topic", "rain"));
        Assertions.assertEquals(Map.of("topic", "rain"), decoded.channelValues());
        Assertions.assertFalse(document.get("pending_sends").isNull());
    }

    @Test
    void untaggedChannelValueIsRejected() {
        ObjectNode document = (ObjectNode) Jsons.readTree(
                "{\"v\":1,\"id\":\"c1\",\"ts\":\"2024-05-01T12:00:00Z\",\"channel_values\":{\"topic\":\"weather\"}}");
        Assertions.assertThrows(SerializationException.class, () -> CheckpointDocument.decode(serde, document));
    }
}
