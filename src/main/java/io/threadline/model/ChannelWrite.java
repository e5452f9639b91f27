package io.threadline.model;

import java.util.Objects;

/** One output of a task: the channel it targets and the value written. */
public record ChannelWrite(String channel, Object value) {
    public ChannelWrite {
        Objects.requireNonNull(channel, "channel");
    }

    public static ChannelWrite of(String channel, Object value) {
        return new ChannelWrite(channel, value);
    }
}
