package org.clausewitz.cwt.error;

/**
 * Internal invariant broken inside the engine. Never reported to users as a diagnostic.
 */
public final class EngineDefectException extends RuntimeException {
    public EngineDefectException(String message) {
        super(message);
    }

    public EngineDefectException(String message, Throwable cause) {
        super(message, cause);
    }
}
