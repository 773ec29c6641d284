package ai.callgraph.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One input file, read fully into memory.
 * Immutable once created; imports are kept in the order they appear (duplicates included).
 */
public record SourceFile(
        String name,        // file name as shown in node labels
        Path path,
        String text,
        List<String> imports
) {
    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
        imports = List.copyOf(imports);
    }
}
