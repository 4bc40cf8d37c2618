package com.herzen.assurance.domain;

import com.herzen.assurance.domain.AssuranceModels.*;
import com.herzen.assurance.error.CompositionErrorCode;
import com.herzen.assurance.error.CompositionException;
import com.herzen.assurance.gsn.ArgumentGraph;

import java.util.*;

public class AssuranceCase {
    private final String id;
    private final String title;
    private final DefeaterLedger ledger = new DefeaterLedger();
    private final List<TransformationRecord> history = new ArrayList<>();

    private Snapshot snapshot = new Snapshot(ArgumentGraph.empty(), null, List.of(), List.of());
    private CaseState state = CaseState.DRAFT;
    private ConfidenceReport lastReport;
    private long revision;

    public AssuranceCase(String id, String title) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
    }

    public static AssuranceCase empty(String id, String title) {
        return new AssuranceCase(id, title);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public ArgumentGraph graph() {
        return snapshot.graph();
    }

    public String rootGoalId() {
        return snapshot.rootGoalId();
    }

    public List<String> openPorts() {
        return snapshot.openPorts();
    }

    public List<String> provenance() {
        return snapshot.provenance();
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public CaseState state() {
        return state;
    }

    public boolean isSealed() {
        return state == CaseState.SEALED;
    }

    public Optional<ConfidenceReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public long revision() {
        return revision;
    }

    public List<TransformationRecord> history() {
        return List.copyOf(history);
    }

    public DefeaterLedger defeaters() {
        return ledger;
    }

    public void requireMutable() {
        if (state == CaseState.SEALED) throw CompositionException.sealed(id);
    }

    // An analyzed case drops back to DRAFT.
    public void commit(Snapshot next, String operation, Map<String, String> arguments) {
        requireMutable();
        this.snapshot = new Snapshot(next.graph().withoutConfidences(), next.rootGoalId(), next.openPorts(), next.provenance());
        this.state = CaseState.DRAFT;
        this.lastReport = null;
        this.revision++;
        history.add(new TransformationRecord(history.size() + 1, operation, arguments, snapshot.graph().size()));
    }

    public void markAnalyzed(ArgumentGraph analyzedGraph, ConfidenceReport report) {
        requireMutable();
        if (!analyzedGraph.withoutConfidences().equals(snapshot.graph().withoutConfidences())) {
            throw new IllegalStateException("Analyzed graph does not match case " + id);
        }
        this.snapshot = new Snapshot(analyzedGraph, snapshot.rootGoalId(), snapshot.openPorts(), snapshot.provenance());
        this.lastReport = report;
        this.state = CaseState.ANALYZED;
    }

    public void seal() {
        requireMutable();
        if (state != CaseState.ANALYZED) {
            throw new CompositionException(CompositionErrorCode.NOT_ANALYZED, null, "Case must be analyzed before sealing: " + id);
        }
        this.state = CaseState.SEALED;
    }

    public Defeater raiseDefeater(Defeater defeater) {
        requireMutable();
        return ledger.raise(defeater);
    }

    public Defeater resolveDefeater(String defeaterId, DefeaterStatus status) {
        requireMutable();
        return ledger.resolve(defeaterId, status);
    }

    public record Snapshot(ArgumentGraph graph, String rootGoalId, List<String> openPorts, List<String> provenance) {
        public Snapshot {
            Objects.requireNonNull(graph, "graph");
            openPorts = List.copyOf(openPorts);
            provenance = List.copyOf(provenance);
        }
    }
}
