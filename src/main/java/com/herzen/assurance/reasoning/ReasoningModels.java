package com.herzen.assurance.reasoning;

import com.herzen.assurance.config.AssuranceProperties;

import java.util.List;
import java.util.OptionalDouble;

public class ReasoningModels {
    public record EvidenceRecord(double confidence, String provenance, int stalenessDays) {
        public EvidenceRecord {
            if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
                throw new IllegalArgumentException("Evidence confidence out of [0,1]: " + confidence);
            }
            if (stalenessDays < 0) {
                throw new IllegalArgumentException("Staleness cannot be negative: " + stalenessDays);
            }
        }

        public static EvidenceRecord fresh(double confidence, String provenance) {
            return new EvidenceRecord(confidence, provenance, 0);
        }
    }

    public record AnalysisOptions(boolean worstCase) {
        public static AnalysisOptions defaults() {
            return new AnalysisOptions(false);
        }

        public static AnalysisOptions worstCaseMode() {
            return new AnalysisOptions(true);
        }
    }

    public record ReasoningSettings(double defeatThreshold,
                                    int stalenessThresholdDays,
                                    int staleWarningDays,
                                    String defaultAggregator,
                                    double structuralSoundnessFactor) {
        public static ReasoningSettings from(AssuranceProperties properties) {
            return new ReasoningSettings(
                    properties.getDefeatThreshold(),
                    properties.getStalenessThresholdDays(),
                    properties.getStaleWarningDays(),
                    properties.getDefaultAggregator(),
                    properties.getStructuralSoundnessFactor());
        }
    }

    public record Finding(String code, String description, double impactWeight, boolean defeats) {
        public static Finding defeating(String code, String description, double impactWeight) {
            return new Finding(code, description, impactWeight, true);
        }
    }

    public record Judgement(OptionalDouble confidence, List<Finding> findings) {
        private static final Judgement NONE = new Judgement(OptionalDouble.empty(), List.of());

        public Judgement {
            findings = List.copyOf(findings);
        }

        public static Judgement none() {
            return NONE;
        }

        public static Judgement of(double confidence) {
            return new Judgement(OptionalDouble.of(confidence), List.of());
        }

        public static Judgement flag(Finding finding) {
            return new Judgement(OptionalDouble.empty(), List.of(finding));
        }
    }
}
