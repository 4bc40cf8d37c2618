package com.herzen.assurance.reasoning;

import com.herzen.assurance.reasoning.ReasoningModels.Judgement;

@FunctionalInterface
public interface BehavioralRule {
    Judgement evaluate(NodeScope scope);
}
