package com.example.nfse.retrieval.model;

import java.util.List;
import java.util.Locale;

public enum DirectionFilter {
    EMITIDAS(List.of(Direction.OUTGOING)),
    RECEBIDAS(List.of(Direction.INCOMING)),
    AMBAS(List.of(Direction.OUTGOING, Direction.INCOMING));

    private final List<Direction> directions;

    DirectionFilter(List<Direction> directions) {
        this.directions = directions;
    }

    /** Directions in execution order: outgoing always precedes incoming. */
    public List<Direction> directions() {
        return directions;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DirectionFilter fromWire(String value) {
        if (value == null || value.isBlank()) {
            return AMBAS;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "Invalid tipo '%s'. Use 'emitidas', 'recebidas' or 'ambas'".formatted(value), ex);
        }
    }
}
