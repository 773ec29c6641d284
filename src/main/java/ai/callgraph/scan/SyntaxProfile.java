package ai.callgraph.scan;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keywords and conventions of the host language the extractors match against.
 * <p>
 * Defaults ({@link #julia()}):
 * - routines open with {@code function} and close with {@code end}
 * - imports use {@code import} / {@code using}
 * - shared state lives in the {@code gdata} structure
 */
public record SyntaxProfile(
        String definitionKeyword,
        String blockTerminator,
        String returnKeyword,
        List<String> importKeywords,
        String globalNamespace,
        String fileExtension,
        Set<String> reservedWords
) {

    /** Identifier, optionally ending in '!' (but not the '!' of {@code !=}). */
    public static final String IDENTIFIER = "[\\p{L}_][\\p{L}\\p{N}_]*(?:!(?!=))?";

    /** Any character that can continue an identifier (Unicode letters and digits included). */
    static final String WORD_CHAR = "\\p{L}\\p{N}_";

    /** Lookbehind that keeps a match from starting in the middle of a word. */
    static final String WORD_START = "(?<![" + WORD_CHAR + "])";

    private static final Set<String> JULIA_RESERVED = Set.of(
            "function", "end", "return", "if", "else", "elseif", "for", "while",
            "begin", "let", "do", "try", "catch", "finally", "struct", "mutable",
            "module", "import", "using", "in", "true", "false", "nothing",
            "local", "global", "const", "break", "continue"
    );

    public SyntaxProfile {
        Objects.requireNonNull(definitionKeyword, "definitionKeyword");
        Objects.requireNonNull(blockTerminator, "blockTerminator");
        Objects.requireNonNull(returnKeyword, "returnKeyword");
        Objects.requireNonNull(globalNamespace, "globalNamespace");
        Objects.requireNonNull(fileExtension, "fileExtension");
        importKeywords = List.copyOf(importKeywords);
        reservedWords = Set.copyOf(reservedWords);
    }

    public static SyntaxProfile julia() {
        return new SyntaxProfile(
                "function",
                "end",
                "return",
                List.of("import", "using"),
                "gdata",
                ".jl",
                JULIA_RESERVED
        );
    }

    public SyntaxProfile withGlobalNamespace(String namespace) {
        return new SyntaxProfile(definitionKeyword, blockTerminator, returnKeyword,
                importKeywords, namespace, fileExtension, reservedWords);
    }

    public SyntaxProfile withFileExtension(String extension) {
        final String ext = extension.startsWith(".") ? extension : "." + extension;
        return new SyntaxProfile(definitionKeyword, blockTerminator, returnKeyword,
                importKeywords, globalNamespace, ext, reservedWords);
    }

    /** The text a definition of {@code routineName} starts with, e.g. {@code "function f"}. */
    public String definitionPrefix(String routineName) {
        return definitionKeyword + " " + routineName;
    }
}
