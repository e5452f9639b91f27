package io.threadline.serde;

public interface Serializer {

    TypedValue dumps(Object value);

    Object loads(TypedValue value);

    <T> T loads(TypedValue value, Class<T> type);
}
