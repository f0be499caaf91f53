package com.lodestar.snapshot;

/**
 * Thrown when a snapshot source cannot be read or does not describe a valid project.
 */
public class SnapshotException extends RuntimeException {
    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
