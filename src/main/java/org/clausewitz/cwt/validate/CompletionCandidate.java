package org.clausewitz.cwt.validate;

import java.util.Optional;

/**
 * One completion proposal.
 *
 * @param label         Text to insert
 * @param kind          Whether the text goes in key or value position
 * @param detail        Short description, e.g. the value shape a key expects
 * @param documentation Text of the rule's {@code ###} comments
 */
public record CompletionCandidate(String label, Kind kind, String detail, Optional<String> documentation) {

    public enum Kind {
        KEY,
        VALUE
    }

    public static CompletionCandidate key(String label, String detail, Optional<String> documentation) {
        return new CompletionCandidate(label, Kind.KEY, detail, documentation);
    }

    public static CompletionCandidate value(String label, String detail) {
        return new CompletionCandidate(label, Kind.VALUE, detail, Optional.empty());
    }
}
