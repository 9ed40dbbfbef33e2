package com.signalfusion.common.exception;

import com.signalfusion.common.model.SpecialistKind;

/**
 * A single specialist call timed out or failed.
 *
 * <p>Retried by the dispatcher and then degraded to an absent outcome; it never
 * escapes the orchestrator on its own.
 */
public class SpecialistException extends FusionException {
    private final SpecialistKind kind;
    private final boolean timeout;

    public SpecialistException(SpecialistKind kind, String symbol, String message) {
        this(kind, symbol, message, null, false);
    }

    public SpecialistException(SpecialistKind kind, String symbol, String message,
                               Throwable cause, boolean timeout) {
        super(symbol, kind + ": " + message, cause);
        this.kind = kind;
        this.timeout = timeout;
    }

    public SpecialistKind getKind() {
        return kind;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
