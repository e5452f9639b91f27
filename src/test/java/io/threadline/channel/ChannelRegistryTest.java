package io.threadline.channel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

final class ChannelRegistryTest {

    @Test
    void defaultsBuildKnownKinds() {
        ChannelRegistry registry = ChannelRegistry.defaults();
        Assertions.assertEquals(Set.of("last_value", "untracked"), registry.kinds());

        Channel<?, ?, ?> untracked = registry.create(new ChannelDefinition(UntrackedValue.KIND, String.class, false));
        Assertions.assertEquals(new UntrackedValue<>(String.class, false), untracked);

        Channel<?, ?, ?> last = registry.create(ChannelDefinition.of(LastValue.KIND, Integer.class));
        Assertions.assertEquals(Integer.class, last.valueType());
    }

    @Test
    void unknownAndDuplicateKindsAreRejected() {
        ChannelRegistry registry = ChannelRegistry.defaults();
        IllegalArgumentException unknown = Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> registry.create(ChannelDefinition.of("topic", String.class))
        );
        Assertions.assertTrue(unknown.getMessage().contains("topic"));
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> registry.register(LastValue.KIND, def -> new LastValue<>(def.valueType()))
        );
    }

    @Test
    void withCheckpointReleasesInstanceWhenStepThrows() {
        LastValue<String> prototype = new LastValue<>(String.class);
        AtomicReference<Channel<String, String, String>> seen = new AtomicReference<>();

        Assertions.assertThrows(IllegalStateException.class, () -> Channels.withCheckpoint(prototype, "saved", scoped -> {
            seen.set(scoped);
            Assertions.assertEquals("saved", scoped.get());
            throw new IllegalStateException("step failed");
        }));
        Assertions.assertThrows(EmptyChannelException.class, () -> seen.get().get());
    }

    @Test
    void withCheckpointReturnsStepResult() {
        LastValue<String> prototype = new LastValue<>(String.class);
        String snapshot = Channels.withCheckpoint(prototype, "a", scoped -> {
            scoped.update(List.of("b"));
            return scoped.checkpoint();
        });
        Assertions.assertEquals("b", snapshot);
    }
}
