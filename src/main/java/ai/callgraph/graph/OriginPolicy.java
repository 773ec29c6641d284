package ai.callgraph.graph;

import java.util.Locale;

/**
 * Which file a routine is attributed to.
 */
public enum OriginPolicy {
    /** The file holding the definition that won the merge. */
    DEFINITION,
    /** The first file, in enumeration order, whose text contains the definition keyword and name. */
    FIRST_MATCH;

    public static OriginPolicy parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "definition" -> DEFINITION;
            case "first-match" -> FIRST_MATCH;
            default -> throw new IllegalArgumentException("unknown origin policy: " + value);
        };
    }
}
