package io.threadline.serde;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.threadline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;

/**
 * Default serializer: raw {@code byte[]} values are stored as-is under the {@value TypedValue#BYTES}
 * tag, everything else is written as JSON.
 *
 * <p>Payloads written by the older Java object serialization scheme are still readable. They are
 * recognised by the stream magic rather than by their tag, so rows that predate the tag column
 * decode too. Writes always produce the current encoding, which upgrades legacy rows the next
 * time they are written.
 */
public final class JsonPlusSerializer implements Serializer {
    private static final Logger log = LoggerFactory.getLogger(JsonPlusSerializer.class);

    static final byte[] LEGACY_STREAM_MAGIC = {(byte) 0xAC, (byte) 0xED, 0x00, 0x05};

    private static final ObjectInputFilter LEGACY_FILTER = ObjectInputFilter.Config.createFilter(
            "maxdepth=64;java.lang.*;java.util.*;java.time.*;java.math.*;io.threadline.model.*;!*");

    private final ObjectMapper mapper;

    public JsonPlusSerializer() {
        this(Jsons.mapper());
    }

    public JsonPlusSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public TypedValue dumps(Object value) {
        if (value instanceof byte[] bytes) {
            return new TypedValue(TypedValue.BYTES, bytes);
        }
        try {
            return new TypedValue(TypedValue.JSON, mapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object loads(TypedValue value) {
        return loads(value, Object.class);
    }

    @Override
    public <T> T loads(TypedValue value, Class<T> type) {
        if (value == null || value.isEmpty()) {
            throw new SerializationException("Cannot decode an empty value marker");
        }
        byte[] data = value.data();
        if (data == null) {
            throw new SerializationException("Missing payload for type tag " + value.type());
        }
        if (isLegacyPayload(data)) {
            return mapper.convertValue(readLegacy(data), type);
        }
        if (TypedValue.BYTES.equals(value.type())) {
            if (!type.isAssignableFrom(byte[].class)) {
                throw new SerializationException("Raw bytes cannot be decoded as " + type.getName());
            }
            return type.cast(data);
        }
        if (!TypedValue.JSON.equals(value.type())) {
            throw new SerializationException("Unknown type tag: " + value.type());
        }
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to decode JSON payload as " + type.getName(), e);
        }
    }

    public static boolean isLegacyPayload(byte[] data) {
        if (data.length < LEGACY_STREAM_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < LEGACY_STREAM_MAGIC.length; i++) {
            if (data[i] != LEGACY_STREAM_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private static Object readLegacy(byte[] data) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            in.setObjectInputFilter(LEGACY_FILTER);
            Object decoded = in.readObject();
            log.warn("Decoded legacy serialized payload of type {}", decoded == null ? "null" : decoded.getClass().getName());
            return decoded;
        } catch (IOException | ClassNotFoundException e) {
            throw new SerializationException("Failed to decode legacy serialized payload", e);
        }
    }
}
