package com.herzen.assurance.reasoning;

import com.herzen.assurance.reasoning.ReasoningModels.Judgement;

public interface Theory {
    String name();

    Judgement judge(NodeScope scope);
}
