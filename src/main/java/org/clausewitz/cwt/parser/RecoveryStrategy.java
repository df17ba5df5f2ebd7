package org.clausewitz.cwt.parser;

/**
 * Error recovery strategy configuration.
 */
public enum RecoveryStrategy {
    /**
     * Stop at the first error and return the tree built so far.
     */
    NONE,

    /**
     * Report the error, skip to the next entry start or closing brace and continue.
     */
    RESYNC
}
