package io.threadline.channel;

import java.util.Objects;

/**
 * Holds the current value behind an explicit "absent" sentinel, so that {@code null} stays a
 * legitimate value.
 */
abstract class AbstractChannel<V> implements Channel<V, V, V> {
    private static final Object MISSING = new Object();

    private final Class<V> valueType;
    private Object value = MISSING;

    AbstractChannel(Class<V> valueType) {
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public Class<V> valueType() {
        return valueType;
    }

    @Override
    public V get() {
        if (value == MISSING) {
            throw new EmptyChannelException();
        }
        return valueType.cast(value);
    }

    final boolean hasValue() {
        return value != MISSING;
    }

    final void set(V newValue) {
        value = newValue;
    }

    @Override
    public void close() {
        value = MISSING;
    }
}
