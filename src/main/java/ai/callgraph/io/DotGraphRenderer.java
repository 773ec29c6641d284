package ai.callgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import ai.callgraph.model.Names;

/**
 * Renders through Graphviz.
 * - format "dot": writes the DOT source itself
 * - any other format: pipes the DOT source into the {@code dot} executable ({@code dot -T<format>})
 */
public final class DotGraphRenderer implements GraphRenderer {

    public static final String DOT_FORMAT = "dot";

    private final String executable;
    private final List<String> nodeLines = new ArrayList<>();
    private final List<String> edgeLines = new ArrayList<>();

    public DotGraphRenderer() {
        this("dot");
    }

    public DotGraphRenderer(String executable) {
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    @Override
    public void addNode(String id, String label) {
        nodeLines.add("  \"" + escape(id) + "\" [label=\"" + escape(label) + "\"];");
    }

    @Override
    public void addEdge(String from, String to) {
        edgeLines.add("  \"" + escape(from) + "\" -> \"" + escape(to) + "\";");
    }

    public String toDot() {
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph CallGraph {\n");
        sb.append("  graph [size=\"15,15\", ratio=auto, dpi=300, nodesep=1, ranksep=1, fontname=Arial, fontsize=10];\n");
        sb.append("  node [shape=rect, style=filled, fillcolor=lightblue, fontsize=10, width=2.5,"
                + " fixedsize=false, labelloc=t, margin=\"0.2,0.2\"];\n");
        for (String line : nodeLines) {
            sb.append(line).append('\n');
        }
        for (String line : edgeLines) {
            sb.append(line).append('\n');
        }
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public void render(Path path, String format) throws RenderException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        final String fmt = format.trim().toLowerCase(Locale.ROOT);

        if (DOT_FORMAT.equals(fmt)) {
            try {
                Files.writeString(path, toDot(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw failure("cannot write " + path + ": " + Names.clip(ex.getMessage()), fmt, ex);
            }
            return;
        }

        final ProcessBuilder pb = new ProcessBuilder(executable, "-T" + fmt, "-o", path.toString())
                .redirectErrorStream(true);
        final Process process;
        try {
            process = pb.start();
        } catch (IOException ex) {
            throw failure("cannot start Graphviz '" + executable + "': " + Names.clip(ex.getMessage()), fmt, ex);
        }

        try {
            try (OutputStream in = process.getOutputStream()) {
                in.write(toDot().getBytes(StandardCharsets.UTF_8));
            }
            final String output;
            try (InputStream out = process.getInputStream()) {
                output = new String(out.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            final int code = process.waitFor();
            if (code != 0) {
                throw failure("Graphviz exited with code " + code + ": " + Names.clip(output), fmt, null);
            }
        } catch (IOException ex) {
            process.destroy();
            throw failure("Graphviz I/O failure: " + Names.clip(ex.getMessage()), fmt, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw failure("interrupted while waiting for Graphviz", fmt, ex);
        }
    }

    private RenderException failure(String message, String format, Throwable cause) {
        return new RenderException(message, format, nodeLines.size(), edgeLines.size(), cause);
    }

    static String escape(String raw) {
        return raw.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r", "")
                .replace("\n", "\\n");
    }
}
