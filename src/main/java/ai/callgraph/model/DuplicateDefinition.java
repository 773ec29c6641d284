package ai.callgraph.model;

/**
 * A routine name defined more than once; the later definition replaced the earlier one.
 */
public record DuplicateDefinition(
        String name,
        String replacedOrigin,
        String winningOrigin
) {
}
