package com.herzen.assurance.reasoning;

import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;

import java.util.Optional;

public interface EvidenceCollector {
    Optional<EvidenceRecord> getEvidence(String solutionId);
}
