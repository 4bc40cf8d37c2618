package com.herzen.assurance.reasoning;

import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEvidenceCollector implements EvidenceCollector {
    private final Map<String, EvidenceRecord> records = new ConcurrentHashMap<>();

    public InMemoryEvidenceCollector put(String solutionId, EvidenceRecord record) {
        records.put(solutionId, record);
        return this;
    }

    public InMemoryEvidenceCollector put(String solutionId, double confidence) {
        return put(solutionId, EvidenceRecord.fresh(confidence, "memory:" + solutionId));
    }

    public void remove(String solutionId) {
        records.remove(solutionId);
    }

    @Override
    public Optional<EvidenceRecord> getEvidence(String solutionId) {
        return Optional.ofNullable(records.get(solutionId));
    }
}
