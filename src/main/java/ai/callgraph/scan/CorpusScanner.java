package ai.callgraph.scan;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import ai.callgraph.model.Names;
import ai.callgraph.model.SkippedFile;
import ai.callgraph.model.SourceFile;
import ai.callgraph.scan.RoutineExtractor.RoutineDefinition;

/**
 * First pass over the corpus: reads each file and extracts its imports and
 * routine definitions. Unreadable files are skipped and remembered.
 */
public final class CorpusScanner {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Charset charset;
    private final ImportExtractor imports;
    private final RoutineExtractor routines;
    private final List<SkippedFile> skipped = new ArrayList<>();

    public CorpusScanner(SyntaxProfile profile, Charset charset) {
        Objects.requireNonNull(profile, "profile");
        this.charset = Objects.requireNonNull(charset, "charset");
        this.imports = new ImportExtractor(profile);
        this.routines = new RoutineExtractor(profile);
    }

    public List<ScannedFile> scan(List<Path> files) {
        Objects.requireNonNull(files, "files");
        final List<ScannedFile> out = new ArrayList<>(files.size());
        for (Path file : files) {
            final ScannedFile scanned = scanFile(file);
            if (scanned != null) {
                out.add(scanned);
            }
        }
        return out;
    }

    private ScannedFile scanFile(Path file) {
        String text;
        try {
            text = Files.readString(file, charset);
        } catch (IOException ex) {
            final String reason = ex.getClass().getSimpleName() + ": " + Names.clip(ex.getMessage());
            skipped.add(new SkippedFile(file.toString(), reason));
            System.err.println("WARN: skipping unreadable file " + file + " -> " + reason);
            return null;
        }
        // a leading BOM would hide a first-line import from the line-anchored patterns
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        final String name = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        return scanText(name, file, text);
    }

    public ScannedFile scanText(String name, Path path, String text) {
        final SourceFile source = new SourceFile(name, path, text, imports.extract(text));
        return new ScannedFile(source, routines.extract(text));
    }

    public List<SkippedFile> skippedFiles() {
        return Collections.unmodifiableList(skipped);
    }

    public record ScannedFile(
            SourceFile source,
            List<RoutineDefinition> definitions
    ) {
        public ScannedFile {
            Objects.requireNonNull(source, "source");
            definitions = List.copyOf(definitions);
        }
    }
}
