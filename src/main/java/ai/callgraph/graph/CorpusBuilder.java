package ai.callgraph.graph;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.callgraph.model.DuplicateDefinition;
import ai.callgraph.model.SourceFile;
import ai.callgraph.scan.BodyScanner;
import ai.callgraph.scan.CorpusScanner;
import ai.callgraph.scan.OutputMode;
import ai.callgraph.scan.SourceCollector;
import ai.callgraph.scan.SyntaxProfile;

/**
 * Builds the corpus index for one source directory.
 * Full scan every time, single-threaded.
 */
public final class CorpusBuilder {

    private final Path sourceDir;
    private final SyntaxProfile profile;
    private final Charset charset;
    private final boolean recursive;
    private final OutputMode outputMode;
    private final OriginPolicy originPolicy;

    public CorpusBuilder(Path sourceDir,
                         SyntaxProfile profile,
                         Charset charset,
                         boolean recursive,
                         OutputMode outputMode,
                         OriginPolicy originPolicy) {
        this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.charset = Objects.requireNonNull(charset, "charset");
        this.recursive = recursive;
        this.outputMode = Objects.requireNonNull(outputMode, "outputMode");
        this.originPolicy = Objects.requireNonNull(originPolicy, "originPolicy");
    }

    public Corpus build() throws IOException {
        // Step 1: enumerate input files
        final SourceCollector collector = new SourceCollector(profile.fileExtension(), recursive);
        final List<Path> paths = collector.collect(sourceDir);

        // Step 2: read files, extract imports and definitions
        final CorpusScanner scanner = new CorpusScanner(profile, charset);
        final var scanned = scanner.scan(paths);

        // Step 3: merge into one symbol table and scan bodies
        final SymbolTableMerger merger = new SymbolTableMerger(
                profile, new BodyScanner(profile, outputMode), originPolicy);
        final CorpusIndex index = merger.merge(scanned);

        for (DuplicateDefinition dup : index.duplicates()) {
            System.err.println("WARN: routine " + dup.name() + " defined again in " + dup.winningOrigin()
                    + " (replaces definition from " + dup.replacedOrigin() + ")");
        }

        final List<SourceFile> files = new ArrayList<>(scanned.size());
        for (var sf : scanned) {
            files.add(sf.source());
        }
        return new Corpus(index, files, scanner.skippedFiles());
    }
}
