package com.herzen.assurance.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class AssuranceModels {
    public enum CaseState { DRAFT, ANALYZED, SEALED }

    public enum DefeaterStatus {
        OPEN, MITIGATED, ACCEPTED_RISK;

        // mitigated defeaters stay in the ledger
        public boolean defeats() {
            return this != MITIGATED;
        }
    }

    public record Defeater(String id,
                           String targetNodeId,
                           String targetEdge,
                           String description,
                           DefeaterStatus status,
                           double impactWeight,
                           String source) {
        public static final String MANUAL_SOURCE = "manual";

        public Defeater {
            Objects.requireNonNull(id, "id");
            status = status == null ? DefeaterStatus.OPEN : status;
            if (impactWeight < 0.0 || impactWeight > 1.0) {
                throw new IllegalArgumentException("Impact weight out of [0,1]: " + impactWeight);
            }
        }

        public static Defeater manual(String id, String targetNodeId, String description, double impactWeight) {
            return new Defeater(id, targetNodeId, null, description, DefeaterStatus.OPEN, impactWeight, MANUAL_SOURCE);
        }

        public Defeater withStatus(DefeaterStatus newStatus) {
            return new Defeater(id, targetNodeId, targetEdge, description, newStatus, impactWeight, source);
        }
    }

    public record ReportWarning(String code, String nodeId, String message) {}

    public enum RiskLevel { LOW, MEDIUM, HIGH }

    public record ConfidenceReport(String caseId,
                                   String rootGoalId,
                                   Map<String, Double> perNodeConfidence,
                                   double overallConfidence,
                                   List<Defeater> defeaters,
                                   List<String> defeatedNodes,
                                   List<ReportWarning> warnings,
                                   RiskLevel riskLevel,
                                   List<String> recommendations,
                                   Map<String, String> evidenceProvenance,
                                   double defeatThreshold) {
        public ConfidenceReport {
            perNodeConfidence = Collections.unmodifiableMap(new LinkedHashMap<>(perNodeConfidence));
            defeaters = List.copyOf(defeaters);
            defeatedNodes = List.copyOf(defeatedNodes);
            warnings = List.copyOf(warnings);
            recommendations = List.copyOf(recommendations);
            evidenceProvenance = Collections.unmodifiableMap(new LinkedHashMap<>(evidenceProvenance));
        }

        public Double confidenceOf(String nodeId) {
            return perNodeConfidence.get(nodeId);
        }

        public boolean isDefeated(String nodeId) {
            return defeatedNodes.contains(nodeId);
        }

        public List<Defeater> defeatersOf(String nodeId) {
            return defeaters.stream().filter(d -> nodeId.equals(d.targetNodeId())).toList();
        }
    }

    public record TransformationRecord(int sequence, String operation, Map<String, String> arguments, int nodeCount) {
        public TransformationRecord {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }
    }
}
