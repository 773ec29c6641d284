package ai.callgraph.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects module names from import statements, in file order.
 * - {@code import A, B}   -> A, B
 * - {@code using A: x, y} -> A (selector list dropped)
 * - {@code import A as B} -> A
 */
public final class ImportExtractor {

    private final Pattern importLine;

    public ImportExtractor(SyntaxProfile profile) {
        Objects.requireNonNull(profile, "profile");
        final List<String> quoted = new ArrayList<>();
        for (String kw : profile.importKeywords()) {
            quoted.add(Pattern.quote(kw));
        }
        this.importLine = Pattern.compile(
                "^[ \\t]*(?:" + String.join("|", quoted) + ")[ \\t]+([^\\r\\n#]+)",
                Pattern.MULTILINE);
    }

    public List<String> extract(String text) {
        Objects.requireNonNull(text, "text");
        final List<String> modules = new ArrayList<>();

        final Matcher m = importLine.matcher(text);
        while (m.find()) {
            String list = m.group(1).trim();
            while (list.endsWith(";")) {
                list = list.substring(0, list.length() - 1).trim();
            }

            final int colon = list.indexOf(':');
            if (colon >= 0) {
                addModule(list.substring(0, colon), modules);
                continue;
            }
            for (String entry : list.split(",")) {
                addModule(entry, modules);
            }
        }
        return modules;
    }

    private static void addModule(String entry, List<String> out) {
        final String trimmed = entry.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        // first token only ("A as B")
        final String[] tokens = trimmed.split("\\s+");
        out.add(tokens[0]);
    }
}
