package ai.callgraph.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.callgraph.model.Names;

/**
 * Writes the graph as a JSON document instead of a drawing.
 */
public final class JsonGraphRenderer implements GraphRenderer {

    public static final String JSON_FORMAT = "json";
    public static final String SCHEMA_VERSION = "call-graph/v1";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    @Override
    public void addNode(String id, String label) {
        nodes.add(new Node(id, label));
    }

    @Override
    public void addEdge(String from, String to) {
        edges.add(new Edge(from, to));
    }

    @Override
    public void render(Path path, String format) throws RenderException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        if (!JSON_FORMAT.equals(format.trim().toLowerCase(Locale.ROOT))) {
            throw new RenderException("unsupported format for JSON renderer", format, nodes.size(), edges.size());
        }
        try {
            mapper.writeValue(path.toFile(), new Document(SCHEMA_VERSION, nodes, edges));
        } catch (IOException ex) {
            throw new RenderException("cannot write " + path + ": " + Names.clip(ex.getMessage()),
                    format, nodes.size(), edges.size(), ex);
        }
    }

    public record Document(
            String schema,
            List<Node> nodes,
            List<Edge> edges
    ) {
    }

    public record Node(
            String id,
            String label
    ) {
    }

    public record Edge(
            String from,
            String to
    ) {
    }
}
