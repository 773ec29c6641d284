package ai.callgraph.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSONL line for routines.jsonl, and the value type of the corpus index.
 */
public record RoutineRecord(
        String name,
        String originFile,        // SourceFile#name of the winning definition
        List<String> imports,     // imports of the origin file
        List<String> inputs,      // parameters as written
        List<String> outputs,     // raw output expressions
        List<String> variables,   // may contain duplicates
        Set<String> globalsTouched,
        List<String> calls        // known routines only, no self-calls
) {
    public RoutineRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(originFile, "originFile");
        imports = List.copyOf(imports);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        variables = List.copyOf(variables);
        globalsTouched = Collections.unmodifiableSet(new LinkedHashSet<>(globalsTouched));
        calls = List.copyOf(calls);
    }

    /** A freshly matched definition whose body has not been scanned yet. */
    public static RoutineRecord partial(String name, SourceFile origin, List<String> inputs) {
        Objects.requireNonNull(origin, "origin");
        return new RoutineRecord(name, origin.name(), origin.imports(), inputs,
                List.of(), List.of(), Set.of(), List.of());
    }

    /** Same record attributed to another file (its name and imports). */
    public RoutineRecord relocatedTo(SourceFile origin) {
        Objects.requireNonNull(origin, "origin");
        return new RoutineRecord(name, origin.name(), origin.imports(), inputs,
                outputs, variables, globalsTouched, calls);
    }

    public RoutineRecord completedWith(List<String> outputs,
                                       List<String> variables,
                                       Set<String> globalsTouched,
                                       List<String> calls) {
        return new RoutineRecord(name, originFile, imports, inputs, outputs, variables, globalsTouched, calls);
    }
}
