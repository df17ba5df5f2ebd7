package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.Diagnostic;

import java.util.List;

/**
 * Result of one validation pass: the diagnostics, or notice that the pass was abandoned.
 */
public sealed interface ValidationOutcome {

    record Completed(List<Diagnostic> diagnostics) implements ValidationOutcome {
        public Completed {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * The token was cancelled before the pass finished; partial results are dropped.
     */
    record Cancelled() implements ValidationOutcome {}

    Cancelled CANCELLED = new Cancelled();

    default boolean isCancelled() {
        return this instanceof Cancelled;
    }

    /**
     * Diagnostics of a completed pass.
     *
     * @throws IllegalStateException if the pass was cancelled
     */
    default List<Diagnostic> diagnostics() {
        if (this instanceof Completed completed) {
            return completed.diagnostics();
        }
        throw new IllegalStateException("Validation was cancelled");
    }
}
