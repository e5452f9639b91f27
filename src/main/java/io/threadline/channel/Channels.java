package io.threadline.channel;

import java.util.function.Function;

public final class Channels {
    private Channels() {
    }

    /**
     * Hydrates a step-local instance from {@code checkpoint}, runs {@code step} against it and
     * releases the instance afterwards, whether or not {@code step} threw.
     */
    public static <V, U, C, R> R withCheckpoint(
            Channel<V, U, C> channel,
            C checkpoint,
            Function<? super Channel<V, U, C>, R> step
    ) {
        try (Channel<V, U, C> scoped = channel.fromCheckpoint(checkpoint)) {
            return step.apply(scoped);
        }
    }
}
