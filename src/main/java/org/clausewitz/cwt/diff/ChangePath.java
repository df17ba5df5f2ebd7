package org.clausewitz.cwt.diff;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Location of a change inside a tree: {@code key#occurrence} segments for entries (the occurrence
 * counts same-named siblings from 0), {@code [index]} segments for bare values and
 * {@code [[NAME]#occurrence} segments for conditional sections.
 */
public record ChangePath(List<String> segments) {
    public static final ChangePath ROOT = new ChangePath(List.of());

    public ChangePath {
        segments = ImmutableList.copyOf(segments);
    }

    public ChangePath key(String folded, int occurrence) {
        return append(folded + "#" + occurrence);
    }

    public ChangePath index(int index) {
        return append("[" + index + "]");
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    private ChangePath append(String segment) {
        return new ChangePath(ImmutableList.<String>builderWithExpectedSize(segments.size() + 1)
                                           .addAll(segments)
                                           .add(segment)
                                           .build());
    }

    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return "/";
        }
        var sb = new StringBuilder();
        for (var segment : segments) {
            boolean index = segment.startsWith("[") && !segment.startsWith("[[");
            if (!index && sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
