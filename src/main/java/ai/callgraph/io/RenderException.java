package ai.callgraph.io;

/**
 * Diagram could not be produced. Carries the graph size so failures on large graphs are easy to spot.
 */
public final class RenderException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String format;
    private final int nodeCount;
    private final int edgeCount;

    public RenderException(String message, String format, int nodeCount, int edgeCount) {
        this(message, format, nodeCount, edgeCount, null);
    }

    public RenderException(String message, String format, int nodeCount, int edgeCount, Throwable cause) {
        super(message + " [format=" + format + ", nodes=" + nodeCount + ", edges=" + edgeCount + "]", cause);
        this.format = format;
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
    }

    public String format() {
        return format;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return edgeCount;
    }
}
