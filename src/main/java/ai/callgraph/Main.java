package ai.callgraph;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Locale;

import ai.callgraph.graph.CallGraph;
import ai.callgraph.graph.Corpus;
import ai.callgraph.graph.CorpusBuilder;
import ai.callgraph.graph.GraphProjector;
import ai.callgraph.graph.OriginPolicy;
import ai.callgraph.io.DotGraphRenderer;
import ai.callgraph.io.GraphRenderer;
import ai.callgraph.io.IndexWriter;
import ai.callgraph.io.JsonGraphRenderer;
import ai.callgraph.io.RenderException;
import ai.callgraph.model.Names;
import ai.callgraph.scan.OutputMode;
import ai.callgraph.scan.SyntaxProfile;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        try {
            return runStages(args);
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + Names.clip(ex.getMessage()));
            return 1;
        }
    }

    private static int runStages(String[] args) {
        Path sourceDir = null;
        Path outDir = null;
        String name = "call_graph";
        String format = "pdf";
        String graphviz = "dot";
        boolean recursive = false;
        boolean writeIndex = true;
        Charset charset = StandardCharsets.UTF_8;
        OutputMode outputMode = OutputMode.RETURN;
        OriginPolicy originPolicy = OriginPolicy.DEFINITION;
        SyntaxProfile profile = SyntaxProfile.julia();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--name=")) {
                    name = arg.substring("--name=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = arg.substring("--format=".length()).trim().toLowerCase(Locale.ROOT);
                    continue;
                }
                if (arg.startsWith("--graphviz=")) {
                    graphviz = arg.substring("--graphviz=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--ext=")) {
                    profile = profile.withFileExtension(arg.substring("--ext=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--globals=")) {
                    profile = profile.withGlobalNamespace(arg.substring("--globals=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--recursive=")) {
                    recursive = Boolean.parseBoolean(arg.substring("--recursive=".length()));
                    continue;
                }
                if (arg.startsWith("--index=")) {
                    writeIndex = Boolean.parseBoolean(arg.substring("--index=".length()));
                    continue;
                }
                if (arg.startsWith("--encoding=")) {
                    charset = Charset.forName(arg.substring("--encoding=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--outputs=")) {
                    outputMode = OutputMode.parse(arg.substring("--outputs=".length()));
                    continue;
                }
                if (arg.startsWith("--origin=")) {
                    originPolicy = OriginPolicy.parse(arg.substring("--origin=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (sourceDir == null) {
                    sourceDir = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + Names.clip(ex.getMessage()));
            printUsage();
            return 2;
        }

        if (sourceDir == null) {
            sourceDir = Paths.get(".");
        }
        sourceDir = sourceDir.toAbsolutePath().normalize();
        if (outDir == null) {
            outDir = sourceDir;
        } else if (!outDir.isAbsolute()) {
            outDir = sourceDir.resolve(outDir).normalize();
        }

        // Stage 1: read sources and build the symbol table
        final Corpus corpus;
        try {
            final CorpusBuilder builder = new CorpusBuilder(
                    sourceDir, profile, charset, recursive, outputMode, originPolicy);
            corpus = builder.build();
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: file read failed: " + Names.clip(ex.getMessage()));
            return 2;
        }

        final CallGraph graph = new GraphProjector().project(corpus.index());

        // Stage 2: render
        final Path diagram = outDir.resolve(name + "." + format);
        try {
            Files.createDirectories(outDir);
            final GraphRenderer renderer = JsonGraphRenderer.JSON_FORMAT.equals(format)
                    ? new JsonGraphRenderer()
                    : new DotGraphRenderer(graphviz);
            renderer.addGraph(graph);
            renderer.render(diagram, format);

            if (writeIndex) {
                new IndexWriter(outDir).writeAll(corpus, graph, Instant.now().toString());
            }
        } catch (RenderException ex) {
            System.err.println("ERROR: render failed: " + Names.clip(ex.getMessage()));
            return 1;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: cannot write output to " + outDir + ": " + Names.clip(ex.getMessage()));
            return 1;
        }

        System.out.println("Call graph written to: " + diagram);
        System.out.println("Files: " + corpus.files().size()
                + ", routines: " + graph.nodes().size()
                + ", calls: " + graph.edges().size());
        if (!corpus.skippedFiles().isEmpty()) {
            System.err.println("WARN: skipped files: " + corpus.skippedFiles().size());
        }
        if (!corpus.index().duplicates().isEmpty()) {
            System.err.println("WARN: duplicate definitions: " + corpus.index().duplicates().size());
        }
        return 0;
    }

    private static void printUsage() {
        System.out.println("Usage: jl-callgraph [sourceDir] [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>         Output directory (default: <sourceDir>)");
        System.out.println("  --name=<name>           Diagram file name without extension (default: call_graph)");
        System.out.println("  --format=<fmt>          dot, json, or any Graphviz output format (default: pdf)");
        System.out.println("  --graphviz=<exe>        Graphviz executable (default: dot)");
        System.out.println("  --ext=<ext>             Source file extension (default: .jl)");
        System.out.println("  --recursive=<bool>      Descend into subdirectories (default: false)");
        System.out.println("  --encoding=<charset>    Source encoding (default: UTF-8)");
        System.out.println("  --globals=<name>        Global data structure name (default: gdata)");
        System.out.println("  --outputs=<mode>        return | assignment (default: return)");
        System.out.println("  --origin=<policy>       definition | first-match (default: definition)");
        System.out.println("  --index=<bool>          Also write routines.jsonl and index.json (default: true)");
        System.out.println("  --help, -h              Show this help");
    }
}
