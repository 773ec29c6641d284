package ai.callgraph.io;

import java.nio.file.Path;

import ai.callgraph.graph.CallGraph;
import ai.callgraph.model.CallEdge;

/**
 * Seam to the diagram renderer. Nodes and edges are fed first, then {@link #render} runs once.
 */
public interface GraphRenderer {

    void addNode(String id, String label);

    void addEdge(String from, String to);

    /** Feeds every node (with its label) and every edge of the graph. */
    default void addGraph(CallGraph graph) {
        for (String node : graph.nodes()) {
            addNode(node, graph.labels().getOrDefault(node, node));
        }
        for (CallEdge edge : graph.edges()) {
            addEdge(edge.from(), edge.to());
        }
    }

    /**
     * Writes the diagram to {@code path} in the given format.
     *
     * @throws RenderException if the format is not supported or the output cannot be produced
     */
    void render(Path path, String format) throws RenderException;
}
