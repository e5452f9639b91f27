package io.threadline.channel;

import java.util.List;

/**
 * Stores the last value received and never checkpoints it. It takes part in execution but is
 * left out of every durable snapshot.
 *
 * <p>When guarded, at most one update per step is accepted; unguarded, the last of several
 * updates wins.
 */
public final class UntrackedValue<V> extends AbstractChannel<V> {
    public static final String KIND = "untracked";

    private final boolean guard;

    public UntrackedValue(Class<V> valueType) {
        this(valueType, true);
    }

    public UntrackedValue(Class<V> valueType, boolean guard) {
        super(valueType);
        this.guard = guard;
    }

    public boolean guard() {
        return guard;
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
        if (values.size() != 1 && guard) {
            throw new InvalidUpdateException("UntrackedValue can only receive one value per step.");
        }
        set(values.get(values.size() - 1));
        return true;
    }

    @Override
    public V checkpoint() {
        throw new EmptyChannelException("UntrackedValue is never checkpointed");
    }

    @Override
    public UntrackedValue<V> fromCheckpoint(V checkpoint) {
        return new UntrackedValue<>(valueType(), guard);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UntrackedValue<?> other && other.guard == guard;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(guard);
    }

    @Override
    public String toString() {
        return "UntrackedValue[guard=" + guard + "]";
    }
}
