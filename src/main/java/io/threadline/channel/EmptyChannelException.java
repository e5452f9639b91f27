package io.threadline.channel;

/**
 * Raised when a channel is read or snapshotted before it ever received a value.
 *
 * <p>Expected during checkpointing: the channel is simply left out of the snapshot.
 */
public final class EmptyChannelException extends RuntimeException {
    public EmptyChannelException() {
        super("Channel is empty");
    }

    public EmptyChannelException(String message) {
        super(message);
    }
}
