package io.threadline.channel;

import java.util.List;

/**
 * Named slot of execution state with merge semantics across one step. Instances from
 * {@link #fromCheckpoint(Object)} are step-scoped and must be closed when the step ends.
 */
public interface Channel<V, U, C> extends AutoCloseable {

    String kind();

    Class<V> valueType();

    /** @return whether the visible value changed */
    boolean update(List<U> values);

    V get();

    C checkpoint();

    /** A {@code null} checkpoint yields an empty instance. */
    Channel<V, U, C> fromCheckpoint(C checkpoint);

    @Override
    void close();
}
