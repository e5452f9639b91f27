package io.threadline.channel;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a channel kind to the factory that builds it. New kinds are registered here; stores never
 * need to know about them.
 */
public final class ChannelRegistry {
    private final Map<String, ChannelFactory> factories = new ConcurrentHashMap<>();

    public static ChannelRegistry defaults() {
        ChannelRegistry registry = new ChannelRegistry();
        registry.register(UntrackedValue.KIND, def -> new UntrackedValue<>(def.valueType(), def.guard()));
        registry.register(LastValue.KIND, def -> new LastValue<>(def.valueType()));
        return registry;
    }

    public ChannelRegistry register(String kind, ChannelFactory factory) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Channel kind must not be blank");
        }
        if (factories.putIfAbsent(kind, factory) != null) {
            throw new IllegalArgumentException("Channel kind already registered: " + kind);
        }
        return this;
    }

    public Channel<?, ?, ?> create(ChannelDefinition definition) {
        ChannelFactory factory = factories.get(definition.kind());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown channel kind: " + definition.kind() + ", known: " + kinds());
        }
        return factory.create(definition);
    }

    public Set<String> kinds() {
        return new TreeSet<>(factories.keySet());
    }

    @FunctionalInterface
    public interface ChannelFactory {
        Channel<?, ?, ?> create(ChannelDefinition definition);
    }
}
