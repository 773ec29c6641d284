package ai.callgraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Lists the source files of a directory that carry the profile's extension.
 * <p>
 * Non-recursive by default (top-level files only). The result is sorted by path
 * so every run enumerates the corpus in the same order.
 */
public final class SourceCollector {

    private final String extension;
    private final boolean recursive;

    public SourceCollector(String extension, boolean recursive) {
        this.extension = Objects.requireNonNull(extension, "extension");
        this.recursive = recursive;
    }

    public List<Path> collect(Path sourceDir) throws IOException {
        Objects.requireNonNull(sourceDir, "sourceDir");
        if (!Files.isDirectory(sourceDir)) {
            throw new IOException("Source directory not found: " + sourceDir);
        }

        final List<Path> files = new ArrayList<>();
        if (recursive) {
            Files.walkFileTree(sourceDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    // Skip tool and build dirs
                    final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (!dir.equals(sourceDir)
                            && (".git".equals(name) || ".idea".equals(name) || "build".equals(name)
                            || "out".equals(name) || "node_modules".equals(name))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasExtension(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } else {
            try (Stream<Path> paths = Files.list(sourceDir)) {
                paths.filter(Files::isRegularFile)
                        .filter(this::hasExtension)
                        .forEach(files::add);
            }
        }

        files.sort(null);
        return files;
    }

    private boolean hasExtension(Path file) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(extension);
    }
}
