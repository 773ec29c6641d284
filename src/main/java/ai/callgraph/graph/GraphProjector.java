package ai.callgraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.callgraph.model.CallEdge;
import ai.callgraph.model.Names;
import ai.callgraph.model.RoutineRecord;

/**
 * Turns the corpus index into nodes, labels and deduplicated edges.
 * Calls to names missing from the index and self-calls never become edges.
 */
public final class GraphProjector {

    public CallGraph project(CorpusIndex index) {
        Objects.requireNonNull(index, "index");

        final List<String> nodes = new ArrayList<>(index.size());
        final Map<String, String> labels = new LinkedHashMap<>();
        final Set<CallEdge> edges = new LinkedHashSet<>();

        for (RoutineRecord r : index.records()) {
            nodes.add(r.name());
            labels.put(r.name(), label(r));
        }

        for (RoutineRecord r : index.records()) {
            for (String callee : r.calls()) {
                if (callee.equals(r.name()) || !index.contains(callee)) {
                    continue;
                }
                edges.add(new CallEdge(r.name(), callee));
            }
        }

        return new CallGraph(nodes, labels, edges);
    }

    static String label(RoutineRecord r) {
        return r.name() + "\n"
                + "File: " + r.originFile() + "\n"
                + "Imports: " + Names.joinOrNone(r.imports()) + "\n"
                + "Inputs: " + Names.joinOrNone(r.inputs()) + "\n"
                + "Outputs: " + Names.joinOrNone(r.outputs()) + "\n"
                + "Globals: " + Names.joinOrNone(r.globalsTouched()) + "\n"
                + "Variables: " + Names.joinOrNone(r.variables());
    }
}
