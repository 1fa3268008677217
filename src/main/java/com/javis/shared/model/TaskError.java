package com.javis.shared.model;

/**
 * Error carried by a failed or cancelled {@link Result}. {@code cause} holds the
 * last attempt's error when the task gave up after retrying.
 */
public record TaskError(ErrorKind kind, String message, TaskError cause) {

    public TaskError {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (message == null) message = kind.name();
    }

    public TaskError(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    /** The innermost error, i.e. what actually went wrong on the last attempt. */
    public TaskError rootCause() {
        var e = this;
        while (e.cause() != null) e = e.cause();
        return e;
    }

    @Override
    public String toString() {
        return cause == null ? kind + ": " + message : kind + ": " + message + " (caused by " + cause + ")";
    }
}
