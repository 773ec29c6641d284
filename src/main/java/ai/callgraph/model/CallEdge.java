package ai.callgraph.model;

import java.util.Objects;

/**
 * Directed call edge; equality on the ordered pair is what deduplicates edges.
 */
public record CallEdge(
        String from,   // caller routine name
        String to      // callee routine name
) {
    public CallEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
