package com.pactum.core.result;

import java.util.Objects;

/**
 * A typed rejection: the kind plus a human-readable message.
 * Messages for signature failures never say which check failed.
 */
public record ProtocolError(ErrorKind kind, String message) {

    public ProtocolError {
        Objects.requireNonNull(kind, "Kind cannot be null");
        message = message != null ? message : kind.code();
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
