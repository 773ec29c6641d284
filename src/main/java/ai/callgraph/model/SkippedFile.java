package ai.callgraph.model;

/**
 * An input file that could not be read and was left out of the corpus.
 */
public record SkippedFile(
        String path,
        String reason
) {
}
