package com.herzen.assurance.reasoning;

import com.herzen.assurance.reasoning.ReasoningModels.Finding;
import com.herzen.assurance.reasoning.ReasoningModels.Judgement;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

@Component
public class BehavioralTheory implements Theory {
    public static final String NAME = "behavioral";

    private final List<BehavioralRule> rules;

    @Autowired
    public BehavioralTheory(ObjectProvider<BehavioralRule> rules) {
        this(rules.orderedStream().toList());
    }

    public BehavioralTheory(List<BehavioralRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Judgement judge(NodeScope scope) {
        if (rules.isEmpty()) return Judgement.none();
        OptionalDouble lowest = OptionalDouble.empty();
        List<Finding> findings = new ArrayList<>();
        for (BehavioralRule rule : rules) {
            Judgement judgement = rule.evaluate(scope);
            if (judgement == null) continue;
            if (judgement.confidence().isPresent()
                    && (lowest.isEmpty() || judgement.confidence().getAsDouble() < lowest.getAsDouble())) {
                lowest = judgement.confidence();
            }
            findings.addAll(judgement.findings());
        }
        return new Judgement(lowest, findings);
    }
}
