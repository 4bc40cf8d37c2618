package com.herzen.assurance.error;

public enum CompositionErrorCode {
    PORT_MISMATCH,
    DUPLICATE_PORT,
    DUPLICATE_NODE,
    CASE_SEALED,
    NOT_A_GOAL,
    DISCONNECTED_SUBGRAPH,
    NOT_ANALYZED,
    UNKNOWN_OPERATION,
    UNKNOWN_STRATEGY,
    NOTHING_TO_COMPOSE
}
