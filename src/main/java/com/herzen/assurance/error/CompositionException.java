package com.herzen.assurance.error;

public class CompositionException extends AssuranceException {
    private final CompositionErrorCode errorCode;
    private final String nodeId;

    public CompositionException(CompositionErrorCode errorCode, String nodeId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.nodeId = nodeId;
    }

    public static CompositionException sealed(String caseId) {
        return new CompositionException(CompositionErrorCode.CASE_SEALED, null, "Case is sealed: " + caseId);
    }

    public CompositionErrorCode errorCode() {
        return errorCode;
    }

    public String nodeId() {
        return nodeId;
    }

    @Override
    public String code() {
        return errorCode.name();
    }
}
