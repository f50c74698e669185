package com.example.nfse.retrieval.model;

public enum Direction {
    OUTGOING("emitidas", "Emitidas"),
    INCOMING("recebidas", "Recebidas");

    private final String wireValue;
    private final String folderName;

    Direction(String wireValue, String folderName) {
        this.wireValue = wireValue;
        this.folderName = folderName;
    }

    public String wireValue() {
        return wireValue;
    }

    public String folderName() {
        return folderName;
    }

    public static boolean isFolderName(String name) {
        for (Direction direction : values()) {
            if (direction.folderName.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
