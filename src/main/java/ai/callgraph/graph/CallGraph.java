package ai.callgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.callgraph.model.CallEdge;

/**
 * Projected call graph, ready to hand to a renderer.
 * - nodes: routine names, in index order
 * - labels: display text per node
 * - edges: deduplicated (caller, callee) pairs
 */
public record CallGraph(
        List<String> nodes,
        Map<String, String> labels,
        Set<CallEdge> edges
) {
    public CallGraph {
        nodes = List.copyOf(nodes);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
    }
}
