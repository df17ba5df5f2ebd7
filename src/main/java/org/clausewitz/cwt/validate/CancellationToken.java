package org.clausewitz.cwt.validate;

import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation flag polled by the validator at every block boundary.
 */
@FunctionalInterface
public interface CancellationToken {
    CancellationToken NEVER = () -> false;

    boolean isCancelled();

    static CancellationToken of(BooleanSupplier cancelled) {
        return cancelled::getAsBoolean;
    }
}
