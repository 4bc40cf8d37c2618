package com.herzen.assurance.reasoning;

import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.reasoning.ReasoningModels.Finding;
import com.herzen.assurance.reasoning.ReasoningModels.Judgement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

@Component
public class StructuralTheory implements Theory {
    public static final String NAME = "structural";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Judgement judge(NodeScope scope) {
        GsnNode node = scope.node();
        List<Finding> findings = new ArrayList<>();
        OptionalDouble confidence = OptionalDouble.empty();

        switch (node.kind()) {
            case STRATEGY -> {
                if (scope.contributions().length < 2) {
                    confidence = OptionalDouble.of(scope.aggregate() * scope.settings().structuralSoundnessFactor());
                }
            }
            case GOAL -> {
                if (scope.isLeaf() && !"true".equals(node.meta("abstracted"))) {
                    findings.add(Finding.defeating("UNDEVELOPED", "Goal " + node.id() + " has no supporting argument", 1.0));
                }
            }
            case SOLUTION -> {
            }
            case CONTEXT, ASSUMPTION, JUSTIFICATION -> {
                if (invalid(node)) {
                    findings.add(Finding.defeating("INVALID_CONTEXT", node.kind() + " " + node.id() + " is marked invalid", 0.5));
                }
            }
        }

        if (node.kind().isNumeric()) {
            List<String> invalidContext = scope.contextNodes().stream().filter(this::invalid).map(GsnNode::id).toList();
            if (!invalidContext.isEmpty()) {
                findings.add(Finding.defeating("INVALID_CONTEXT", node.id() + " is stated in invalid context " + invalidContext, 0.5));
            }
        }
        return new Judgement(confidence, findings);
    }

    private boolean invalid(GsnNode node) {
        return "false".equalsIgnoreCase(node.meta("valid"));
    }
}
