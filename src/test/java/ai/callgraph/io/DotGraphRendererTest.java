package ai.callgraph.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.callgraph.graph.CallGraph;
import ai.callgraph.model.CallEdge;

class DotGraphRendererTest {

    @TempDir
    Path dir;

    private static CallGraph sample() {
        return new CallGraph(
                List.of("f", "g"),
                Map.of("f", "f\nInputs: x", "g", "g \"quoted\""),
                Set.of(new CallEdge("f", "g")));
    }

    @Test
    void dotSourceHasNodesEdgesAndStyling() {
        final DotGraphRenderer renderer = new DotGraphRenderer();
        renderer.addGraph(sample());

        final String dot = renderer.toDot();

        assertThat(dot).startsWith("digraph CallGraph {\n");
        assertThat(dot).contains("fillcolor=lightblue");
        assertThat(dot).contains("  \"f\" [label=\"f\\nInputs: x\"];");
        assertThat(dot).contains("  \"g\" [label=\"g \\\"quoted\\\"\"];");
        assertThat(dot).contains("  \"f\" -> \"g\";");
        assertThat(dot).endsWith("}\n");
    }

    @Test
    void dotFormatWritesSourceFile() throws Exception {
        final DotGraphRenderer renderer = new DotGraphRenderer();
        renderer.addGraph(sample());
        final Path out = dir.resolve("graph.dot");

        renderer.render(out, "DOT");

        assertThat(Files.readString(out, StandardCharsets.UTF_8)).isEqualTo(renderer.toDot());
    }

    @Test
    void missingGraphvizExecutableIsReportedWithGraphSize() {
        final DotGraphRenderer renderer = new DotGraphRenderer("no-such-graphviz-binary-on-path");
        renderer.addGraph(sample());

        assertThatThrownBy(() -> renderer.render(dir.resolve("graph.pdf"), "pdf"))
                .hasMessageContaining("nodes=2")
                .hasMessageContaining("edges=1")
                .isInstanceOfSatisfying(RenderException.class, re -> {
                    assertThat(re.format()).isEqualTo("pdf");
                    assertThat(re.nodeCount()).isEqualTo(2);
                    assertThat(re.edgeCount()).isEqualTo(1);
                    assertThat(re.getCause()).isInstanceOf(IOException.class);
                });
    }

    @Test
    void unwritableDotTargetFails() {
        final DotGraphRenderer renderer = new DotGraphRenderer();

        assertThatThrownBy(() -> renderer.render(dir.resolve("missing/dir/graph.dot"), "dot"))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("nodes=0");
    }
}
