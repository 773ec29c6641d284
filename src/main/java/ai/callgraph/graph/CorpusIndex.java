package ai.callgraph.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.callgraph.model.DuplicateDefinition;
import ai.callgraph.model.RoutineRecord;
import ai.callgraph.model.SourceFile;
import ai.callgraph.scan.SyntaxProfile;

/**
 * Corpus-wide symbol table: routine name -> record.
 * <p>
 * - A later definition of a name replaces the earlier one (recorded as a duplicate)
 * - Iteration follows the order names were first defined
 */
public final class CorpusIndex {

    private final Map<String, RoutineRecord> routines = new LinkedHashMap<>();
    private final List<DuplicateDefinition> duplicates = new ArrayList<>();

    /** Adds a definition; returns the record it replaced, if any. */
    public Optional<RoutineRecord> register(RoutineRecord routine) {
        Objects.requireNonNull(routine, "routine");
        final RoutineRecord previous = routines.put(routine.name(), routine);
        if (previous != null) {
            duplicates.add(new DuplicateDefinition(routine.name(), previous.originFile(), routine.originFile()));
        }
        return Optional.ofNullable(previous);
    }

    /** Replaces the record of an already registered name without counting it as a duplicate. */
    void complete(RoutineRecord routine) {
        Objects.requireNonNull(routine, "routine");
        if (!routines.containsKey(routine.name())) {
            throw new IllegalStateException("Routine not registered: " + routine.name());
        }
        routines.put(routine.name(), routine);
    }

    public Optional<RoutineRecord> get(String name) {
        return Optional.ofNullable(routines.get(name));
    }

    public boolean contains(String name) {
        return routines.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(routines.keySet());
    }

    public Collection<RoutineRecord> records() {
        return Collections.unmodifiableCollection(routines.values());
    }

    public int size() {
        return routines.size();
    }

    public boolean isEmpty() {
        return routines.isEmpty();
    }

    public List<DuplicateDefinition> duplicates() {
        return Collections.unmodifiableList(duplicates);
    }

    /**
     * Origin of a routine recovered from raw text: the first file, in the given
     * order, whose text contains {@code "<keyword> <name>"}.
     */
    public static Optional<SourceFile> originByTextSearch(String name,
                                                          List<SourceFile> files,
                                                          SyntaxProfile profile) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(profile, "profile");
        final String needle = profile.definitionPrefix(name);
        for (SourceFile file : files) {
            if (file.text().contains(needle)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }
}
