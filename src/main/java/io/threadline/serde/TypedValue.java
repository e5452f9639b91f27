package io.threadline.serde;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serialized value envelope: a type tag selecting the decoder plus the encoded bytes.
 *
 * <p>The {@value #EMPTY} tag marks "no value present" and carries no bytes. It is distinct
 * from an encoded {@code null}, which is a regular JSON payload.
 */
public record TypedValue(String type, byte[] data) {
    public static final String EMPTY = "empty";
    public static final String JSON = "json";
    public static final String BYTES = "bytes";

    private static final TypedValue EMPTY_VALUE = new TypedValue(EMPTY, null);

    public TypedValue {
        Objects.requireNonNull(type, "type");
    }

    public static TypedValue empty() {
        return EMPTY_VALUE;
    }

    public boolean isEmpty() {
        return EMPTY.equals(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedValue other)) {
            return false;
        }
        return type.equals(other.type) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TypedValue[type=" + type + ", bytes=" + (data == null ? 0 : data.length) + "]";
    }
}
