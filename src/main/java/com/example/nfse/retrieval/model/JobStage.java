package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStage {
    QUEUED("inicio"),
    AUTHENTICATE("autenticacao"),
    SCAN_OUTGOING("processamento_emitidas"),
    SCAN_INCOMING("processamento_recebidas"),
    FINALIZE("finalizacao");

    private final String label;

    JobStage(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static JobStage scanning(Direction direction) {
        return direction == Direction.OUTGOING ? SCAN_OUTGOING : SCAN_INCOMING;
    }
}
