package ai.callgraph.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.callgraph.model.RoutineRecord;
import ai.callgraph.model.SourceFile;
import ai.callgraph.scan.BodyScanner;
import ai.callgraph.scan.BodyScanner.BodyFacts;
import ai.callgraph.scan.CorpusScanner.ScannedFile;
import ai.callgraph.scan.RoutineExtractor.RoutineDefinition;
import ai.callgraph.scan.SyntaxProfile;

/**
 * Folds per-file definitions into one {@link CorpusIndex}, then scans every
 * surviving body against the complete set of routine names.
 */
public final class SymbolTableMerger {

    private final SyntaxProfile profile;
    private final BodyScanner bodyScanner;
    private final OriginPolicy originPolicy;

    public SymbolTableMerger(SyntaxProfile profile, BodyScanner bodyScanner, OriginPolicy originPolicy) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.bodyScanner = Objects.requireNonNull(bodyScanner, "bodyScanner");
        this.originPolicy = Objects.requireNonNull(originPolicy, "originPolicy");
    }

    public CorpusIndex merge(List<ScannedFile> files) {
        Objects.requireNonNull(files, "files");

        // Pass 1: register definitions, last one wins
        final CorpusIndex index = new CorpusIndex();
        final Map<String, String> bodies = new HashMap<>();
        final List<SourceFile> sources = new ArrayList<>(files.size());

        for (ScannedFile file : files) {
            final SourceFile source = file.source();
            sources.add(source);
            for (RoutineDefinition def : file.definitions()) {
                index.register(RoutineRecord.partial(def.name(), source, def.inputs()));
                bodies.put(def.name(), bodyScanner.delimit(source.text(), def));
            }
        }

        // Pass 2: scan bodies; calls can only target names known after pass 1
        for (RoutineRecord partial : new ArrayList<>(index.records())) {
            final BodyFacts facts = bodyScanner.scan(
                    partial.name(), partial.inputs(), bodies.get(partial.name()), index.names());

            RoutineRecord completed = partial.completedWith(
                    facts.outputs(), facts.variables(), facts.globalsTouched(), facts.calls());
            if (originPolicy == OriginPolicy.FIRST_MATCH) {
                final var firstMatch = CorpusIndex.originByTextSearch(partial.name(), sources, profile);
                if (firstMatch.isPresent()) {
                    completed = completed.relocatedTo(firstMatch.get());
                }
            }
            index.complete(completed);
        }

        return index;
    }
}
