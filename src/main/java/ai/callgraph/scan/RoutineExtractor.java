package ai.callgraph.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds routine definitions of the shape {@code <keyword> <name>(<params>)}.
 * <p>
 * Nesting is ignored: a definition inside another routine's body is reported
 * like any other. The parameter list may span several lines.
 */
public final class RoutineExtractor {

    private final Pattern definition;

    public RoutineExtractor(SyntaxProfile profile) {
        Objects.requireNonNull(profile, "profile");
        this.definition = Pattern.compile(
                SyntaxProfile.WORD_START + Pattern.quote(profile.definitionKeyword())
                        + "\\s+(" + SyntaxProfile.IDENTIFIER + ")\\s*\\(([^)]*)\\)");
    }

    public List<RoutineDefinition> extract(String text) {
        Objects.requireNonNull(text, "text");
        final List<RoutineDefinition> out = new ArrayList<>();

        final Matcher m = definition.matcher(text);
        while (m.find()) {
            out.add(new RoutineDefinition(
                    m.group(1),
                    splitParameters(m.group(2)),
                    m.start(),
                    m.end()));
        }
        return out;
    }

    static List<String> splitParameters(String raw) {
        final List<String> params = new ArrayList<>();
        for (String p : raw.split(",")) {
            final String trimmed = p.trim();
            if (!trimmed.isEmpty()) {
                params.add(trimmed);
            }
        }
        return params;
    }

    /**
     * One matched definition.
     * {@code start} is the offset of the definition keyword, {@code headerEnd} the offset just past ')'.
     */
    public record RoutineDefinition(
            String name,
            List<String> inputs,
            int start,
            int headerEnd
    ) {
        public RoutineDefinition {
            Objects.requireNonNull(name, "name");
            inputs = List.copyOf(inputs);
        }
    }
}
