package ai.callgraph.scan;

import java.util.Locale;

/**
 * How a routine's outputs are guessed.
 */
public enum OutputMode {
    /** Text after the return keyword. */
    RETURN,
    /** Right-hand side of assignments to one of the routine's own parameters. */
    ASSIGNMENT;

    public static OutputMode parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "return" -> RETURN;
            case "assignment" -> ASSIGNMENT;
            default -> throw new IllegalArgumentException("unknown output mode: " + value);
        };
    }
}
