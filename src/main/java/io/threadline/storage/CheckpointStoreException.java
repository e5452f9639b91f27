package io.threadline.storage;

/** Storage or connection failure, surfaced unchanged to the caller; stores never retry. */
public final class CheckpointStoreException extends RuntimeException {
    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
