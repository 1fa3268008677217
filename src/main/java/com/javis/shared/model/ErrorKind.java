package com.javis.shared.model;

public enum ErrorKind {
    CLASSIFICATION_AMBIGUOUS,
    DUPLICATE_AGENT,
    NO_CAPABLE_AGENT,
    AGENT_EXECUTION,
    RETRY_EXHAUSTED,
    TIMEOUT,
    CANCELLED
}
