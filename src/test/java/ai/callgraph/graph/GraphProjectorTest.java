package ai.callgraph.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.callgraph.model.CallEdge;
import ai.callgraph.model.RoutineRecord;
import ai.callgraph.model.SourceFile;

class GraphProjectorTest {

    private final GraphProjector projector = new GraphProjector();
    private final SourceFile origin = new SourceFile("a.jl", Path.of("a.jl"), "", List.of("CSV"));

    private RoutineRecord routine(String name, String... calls) {
        return RoutineRecord.partial(name, origin, List.of())
                .completedWith(List.of(), List.of(), Set.of(), List.of(calls));
    }

    @Test
    void repeatedCallsGiveOneEdge() {
        final CorpusIndex index = new CorpusIndex();
        index.register(routine("r", "s", "s", "s"));
        index.register(routine("s"));

        final CallGraph graph = projector.project(index);

        assertThat(graph.nodes()).containsExactly("r", "s");
        assertThat(graph.edges()).containsExactly(new CallEdge("r", "s"));
    }

    @Test
    void selfCallsAndUnknownCalleesNeverBecomeEdges() {
        final CorpusIndex index = new CorpusIndex();
        index.register(routine("r", "r", "ghost", "s"));
        index.register(routine("s", "r"));

        final CallGraph graph = projector.project(index);

        assertThat(graph.edges()).containsExactly(new CallEdge("r", "s"), new CallEdge("s", "r"));
    }

    @Test
    void emptyIndexGivesEmptyGraph() {
        final CallGraph graph = projector.project(new CorpusIndex());

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.labels()).isEmpty();
    }

    @Test
    void labelListsEveryAttributeAndNoneForEmpty() {
        final RoutineRecord r = RoutineRecord.partial("f", origin, List.of("x", "n::Int"))
                .completedWith(List.of("y"), List.of("x", "y"), Set.of("counter"), List.of());

        assertThat(GraphProjector.label(r)).isEqualTo(
                "f\n"
                        + "File: a.jl\n"
                        + "Imports: CSV\n"
                        + "Inputs: x, n::Int\n"
                        + "Outputs: y\n"
                        + "Globals: counter\n"
                        + "Variables: x, y");
        assertThat(GraphProjector.label(routine("g"))).contains("Outputs: None").contains("Globals: None");
    }
}
