package com.dataworks.orchestrator.conversation;

public enum TurnType {
    HUMAN,
    DECISION,
    OBSERVATION,
    FINAL
}
