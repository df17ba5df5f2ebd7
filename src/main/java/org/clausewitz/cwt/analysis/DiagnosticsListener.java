package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.error.Diagnostic;

import java.util.List;

/**
 * Receives each diagnostics set the store publishes. Called on a worker thread, never with a
 * store lock held.
 */
@FunctionalInterface
public interface DiagnosticsListener {
    void published(String path, long revision, List<Diagnostic> diagnostics);
}
