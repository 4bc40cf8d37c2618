package com.herzen.assurance.error;

import java.util.List;

public class MissingEvidenceException extends AssuranceException {
    private final List<String> solutionIds;

    public MissingEvidenceException(List<String> solutionIds) {
        super("No evidence resolved for solutions " + solutionIds);
        this.solutionIds = List.copyOf(solutionIds);
    }

    public List<String> solutionIds() {
        return solutionIds;
    }

    @Override
    public String code() {
        return "MISSING_EVIDENCE";
    }
}
