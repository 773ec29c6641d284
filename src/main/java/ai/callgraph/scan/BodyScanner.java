package ai.callgraph.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.callgraph.model.Names;
import ai.callgraph.scan.RoutineExtractor.RoutineDefinition;

/**
 * Delimits a routine's body and scans it line by line for outputs,
 * global writes, variables and calls.
 * <p>
 * The body runs from the definition keyword up to the first whole-word block
 * terminator after the parameter list. Terminators of nested blocks cut the
 * body short; definitions nested inside the body are scanned as part of it.
 */
public final class BodyScanner {

    private static final String NOT_AFTER_WORD_OR_DOT = "(?<![" + SyntaxProfile.WORD_CHAR + ".@])";

    private final SyntaxProfile profile;
    private final OutputMode outputMode;

    private final Pattern terminator;
    private final Pattern returnLine;
    private final Pattern parameterAssignment;
    private final Pattern globalWrite;
    private final Pattern variable;
    private final Pattern call;

    public BodyScanner(SyntaxProfile profile, OutputMode outputMode) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.outputMode = Objects.requireNonNull(outputMode, "outputMode");

        this.terminator = Pattern.compile(
                SyntaxProfile.WORD_START + Pattern.quote(profile.blockTerminator()) + "(?![" + SyntaxProfile.WORD_CHAR + "!])");
        this.returnLine = Pattern.compile(
                "^" + Pattern.quote(profile.returnKeyword()) + "(?![" + SyntaxProfile.WORD_CHAR + "!])(.*)$");
        this.parameterAssignment = Pattern.compile(
                NOT_AFTER_WORD_OR_DOT + "(" + SyntaxProfile.IDENTIFIER + ")\\s*(?<![=!<>])=(?!=)\\s*([" + SyntaxProfile.WORD_CHAR + ".]+)");
        this.globalWrite = Pattern.compile(
                NOT_AFTER_WORD_OR_DOT + Pattern.quote(profile.globalNamespace())
                        + "\\.(" + SyntaxProfile.IDENTIFIER + ")\\s*(?<![=!<>])=(?!=)");
        this.variable = Pattern.compile(
                NOT_AFTER_WORD_OR_DOT + "(" + SyntaxProfile.IDENTIFIER + ")"
                        + "(?:\\s*::\\s*[\\p{L}_][" + SyntaxProfile.WORD_CHAR + ".]*(?:\\{[^}\\r\\n]*\\})?)?");
        this.call = Pattern.compile(
                SyntaxProfile.WORD_START + "(" + SyntaxProfile.IDENTIFIER + ")\\(");
    }

    /**
     * Text of the routine's body: from the definition keyword up to (not including)
     * the first block terminator after the header, or the end of the text.
     */
    public String delimit(String text, RoutineDefinition definition) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(definition, "definition");

        final Matcher m = terminator.matcher(text);
        final int end = m.find(definition.headerEnd()) ? m.start() : text.length();
        return text.substring(definition.start(), end);
    }

    public BodyFacts scan(String routineName, List<String> inputs, String body, Set<String> knownRoutines) {
        Objects.requireNonNull(routineName, "routineName");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(knownRoutines, "knownRoutines");

        final Set<String> parameterNames = new LinkedHashSet<>();
        for (String input : inputs) {
            final String bare = Names.bareParameterName(input);
            if (!bare.isEmpty()) {
                parameterNames.add(bare);
            }
        }

        final List<String> outputs = new ArrayList<>();
        final List<String> variables = new ArrayList<>();
        final Set<String> globals = new LinkedHashSet<>();
        final List<String> calls = new ArrayList<>();

        for (String line : body.split("\\R")) {
            if (outputMode == OutputMode.RETURN) {
                collectReturn(line, outputs);
            } else {
                collectParameterAssignments(line, parameterNames, outputs);
            }

            final Matcher g = globalWrite.matcher(line);
            while (g.find()) {
                globals.add(g.group(1));
            }

            final Matcher v = variable.matcher(line);
            while (v.find()) {
                final String name = v.group(1);
                if (!profile.reservedWords().contains(name)) {
                    variables.add(name);
                }
            }

            final Matcher c = call.matcher(line);
            while (c.find()) {
                final String callee = c.group(1);
                if (!callee.equals(routineName) && knownRoutines.contains(callee)) {
                    calls.add(callee);
                }
            }
        }

        return new BodyFacts(outputs, variables, globals, calls);
    }

    private void collectReturn(String line, List<String> outputs) {
        final Matcher r = returnLine.matcher(line.trim());
        if (!r.matches()) {
            return;
        }
        String expr = r.group(1).trim();
        while (expr.endsWith(";")) {
            expr = expr.substring(0, expr.length() - 1).trim();
        }
        if (!expr.isEmpty()) {
            outputs.add(expr);
        }
    }

    private void collectParameterAssignments(String line, Set<String> parameterNames, List<String> outputs) {
        final Matcher a = parameterAssignment.matcher(line);
        while (a.find()) {
            if (parameterNames.contains(a.group(1))) {
                outputs.add(a.group(2));
            }
        }
    }

    /**
     * What a body scan found. Lists keep textual order and duplicates.
     */
    public record BodyFacts(
            List<String> outputs,
            List<String> variables,
            Set<String> globalsTouched,
            List<String> calls
    ) {
        public BodyFacts {
            outputs = List.copyOf(outputs);
            variables = List.copyOf(variables);
            globalsTouched = Collections.unmodifiableSet(new LinkedHashSet<>(globalsTouched));
            calls = List.copyOf(calls);
        }
    }
}
