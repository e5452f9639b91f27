package io.threadline.channel;

import java.util.List;

/**
 * Stores the last value received; accepts at most one value per step.
 */
public final class LastValue<V> extends AbstractChannel<V> {
    public static final String KIND = "last_value";

    public LastValue(Class<V> valueType) {
        super(valueType);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public boolean update(List<V> values) {
        if (values.isEmpty()) {
            return false;
        }
        if (values.size() != 1) {
            throw new InvalidUpdateException("LastValue can only receive one value per step.");
        }
        set(values.get(0));
        return true;
    }

    @Override
    public V checkpoint() {
        return get();
    }

    @Override
    public LastValue<V> fromCheckpoint(V checkpoint) {
        LastValue<V> fresh = new LastValue<>(valueType());
        if (checkpoint != null) {
            fresh.set(checkpoint);
        }
        return fresh;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LastValue<?> other && other.valueType().equals(valueType());
    }

    @Override
    public int hashCode() {
        return valueType().hashCode();
    }

    @Override
    public String toString() {
        return "LastValue[" + valueType().getSimpleName() + "]";
    }
}
