package ai.callgraph.graph;

import java.util.List;

import ai.callgraph.model.SkippedFile;
import ai.callgraph.model.SourceFile;

/**
 * Result of a corpus pass: the symbol table plus what was read and what was skipped.
 */
public record Corpus(
        CorpusIndex index,
        List<SourceFile> files,
        List<SkippedFile> skippedFiles
) {
    public Corpus {
        files = List.copyOf(files);
        skippedFiles = List.copyOf(skippedFiles);
    }
}
