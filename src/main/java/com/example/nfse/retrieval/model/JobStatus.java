package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    PENDING("pendente"),
    RUNNING("em_execucao"),
    SUCCEEDED("concluido"),
    FAILED("falhou"),
    CANCELLED("cancelado");

    private final String wireValue;

    JobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
