package ai.callgraph.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.callgraph.graph.CallGraph;
import ai.callgraph.graph.Corpus;
import ai.callgraph.graph.CorpusBuilder;
import ai.callgraph.graph.GraphProjector;
import ai.callgraph.graph.OriginPolicy;
import ai.callgraph.scan.OutputMode;
import ai.callgraph.scan.SyntaxProfile;

class IndexWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesRoutineLinesAndSummary() throws Exception {
        final Path src = Files.createDirectories(dir.resolve("src"));
        Files.writeString(src.resolve("a.jl"),
                "import CSV\nfunction f(x)\n  y = g(x)\n  return y\nend\nfunction g(z)\n  gdata.z = z\nend\n");
        Files.writeString(src.resolve("b.jl"), "function g(w)\n  return w\nend\n");
        Files.write(src.resolve("c.jl"), new byte[] {(byte) 0xC3, (byte) 0x28});

        final Corpus corpus = new CorpusBuilder(src, SyntaxProfile.julia(), StandardCharsets.UTF_8, false,
                OutputMode.RETURN, OriginPolicy.DEFINITION).build();
        final CallGraph graph = new GraphProjector().project(corpus.index());
        final Path out = dir.resolve("out");

        new IndexWriter(out).writeAll(corpus, graph, "2026-01-01T00:00:00Z");

        final ObjectMapper mapper = new ObjectMapper();
        final List<String> lines = Files.readAllLines(out.resolve(IndexWriter.ROUTINES_FILE), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        final JsonNode f = mapper.readTree(lines.get(0));
        assertThat(f.get("name").asText()).isEqualTo("f");
        assertThat(f.get("originFile").asText()).isEqualTo("a.jl");
        assertThat(f.get("imports").get(0).asText()).isEqualTo("CSV");
        assertThat(f.get("calls").get(0).asText()).isEqualTo("g");
        final JsonNode g = mapper.readTree(lines.get(1));
        assertThat(g.get("originFile").asText()).isEqualTo("b.jl");

        final JsonNode idx = mapper.readTree(out.resolve(IndexWriter.INDEX_FILE).toFile());
        assertThat(idx.get("schema").asText()).isEqualTo(IndexWriter.SCHEMA_VERSION);
        assertThat(idx.get("generatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(idx.get("summary").get("files").asInt()).isEqualTo(2);
        assertThat(idx.get("summary").get("routines").asInt()).isEqualTo(2);
        assertThat(idx.get("summary").get("edges").asInt()).isEqualTo(1);
        assertThat(idx.get("summary").get("skippedFiles").asInt()).isEqualTo(1);
        assertThat(idx.get("summary").get("duplicates").asInt()).isEqualTo(1);
        assertThat(idx.get("duplicates").get(0).get("name").asText()).isEqualTo("g");
        assertThat(idx.get("skippedFiles").get(0).get("path").asText()).endsWith("c.jl");
    }
}
