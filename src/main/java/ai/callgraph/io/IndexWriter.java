package ai.callgraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.callgraph.graph.CallGraph;
import ai.callgraph.graph.Corpus;
import ai.callgraph.model.DuplicateDefinition;
import ai.callgraph.model.RoutineRecord;
import ai.callgraph.model.SkippedFile;

/**
 * Writes the machine-readable index next to the diagram:
 * - routines.jsonl: one routine record per line, in index order
 * - index.json: schema, counts, skipped files and duplicate definitions
 */
public final class IndexWriter {

    public static final String SCHEMA_VERSION = "call-index/v1";
    public static final String ROUTINES_FILE = "routines.jsonl";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public IndexWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public void writeAll(Corpus corpus, CallGraph graph, String generatedAt) throws IOException {
        Objects.requireNonNull(corpus, "corpus");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        final List<RoutineRecord> routines = List.copyOf(corpus.index().records());
        writeJsonl(outDir.resolve(ROUTINES_FILE), routines);

        final Summary summary = new Summary(
                corpus.files().size(),
                routines.size(),
                graph.edges().size(),
                corpus.skippedFiles().size(),
                corpus.index().duplicates().size()
        );

        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                ROUTINES_FILE,
                summary,
                corpus.skippedFiles(),
                corpus.index().duplicates()
        );
        jsonMapper.writeValue(outDir.resolve(INDEX_FILE).toFile(), idx);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        // overwrite each time (simple + deterministic)
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            String routines,
            Summary summary,
            List<SkippedFile> skippedFiles,
            List<DuplicateDefinition> duplicates
    ) {
    }

    public record Summary(
            int files,
            int routines,
            int edges,
            int skippedFiles,
            int duplicates
    ) {
    }
}
