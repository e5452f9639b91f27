package io.threadline.channel;

import java.util.Objects;

public record ChannelDefinition(String kind, Class<?> valueType, boolean guard) {
    public ChannelDefinition {
        Objects.requireNonNull(kind, "kind");
        valueType = valueType == null ? Object.class : valueType;
    }

    public static ChannelDefinition of(String kind, Class<?> valueType) {
        return new ChannelDefinition(kind, valueType, true);
    }
}
