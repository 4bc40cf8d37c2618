package com.herzen.assurance.error;

public class AcqlEvaluationException extends AssuranceException {
    private final String nodeRef;

    public AcqlEvaluationException(String nodeRef, String message) {
        super(message);
        this.nodeRef = nodeRef;
    }

    public String nodeRef() {
        return nodeRef;
    }

    @Override
    public String code() {
        return "EVALUATION_ERROR";
    }
}
