package io.threadline.model;

/** A task output recorded against a checkpoint before being folded into the next one. */
public record PendingWrite(String taskId, String channel, Object value) {
}
