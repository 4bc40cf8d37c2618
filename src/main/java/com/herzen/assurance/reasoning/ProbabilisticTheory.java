package com.herzen.assurance.reasoning;

import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.reasoning.ReasoningModels.EvidenceRecord;
import com.herzen.assurance.reasoning.ReasoningModels.Judgement;
import org.springframework.stereotype.Component;

@Component
public class ProbabilisticTheory implements Theory {
    public static final String NAME = "probabilistic";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Judgement judge(NodeScope scope) {
        GsnNode node = scope.node();
        return switch (node.kind()) {
            case SOLUTION -> Judgement.of(solution(scope));
            case STRATEGY -> Judgement.of(scope.aggregate());
            case GOAL -> Judgement.of(goal(scope));
            case CONTEXT, ASSUMPTION, JUSTIFICATION -> Judgement.none();
        };
    }

    private double solution(NodeScope scope) {
        EvidenceRecord evidence = scope.evidence().orElse(null);
        if (evidence == null) return 0.0;
        int threshold = scope.settings().stalenessThresholdDays();
        double freshness = threshold <= 0 ? 1.0 : Math.max(0.0, 1.0 - (double) evidence.stalenessDays() / threshold);
        return evidence.confidence() * freshness;
    }

    private double goal(NodeScope scope) {
        double[] contributions = scope.contributions();
        if (contributions.length == 0) return abstractedConfidence(scope.node());
        if (contributions.length == 1) return contributions[0];
        double allFail = 1.0;
        for (double c : contributions) allFail *= 1.0 - c;
        return 1.0 - allFail;
    }

    // undeveloped unless standing in for a collapsed subgraph
    private double abstractedConfidence(GsnNode goal) {
        if (!"true".equals(goal.meta("abstracted"))) return 0.0;
        String display = goal.meta("displayConfidence");
        if (display == null) return 0.0;
        try {
            return NodeScope.clamp(Double.parseDouble(display));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
