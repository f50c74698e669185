package com.example.nfse.retrieval.config;

public enum ViewportPreset {
    HD(1280, 720),
    FULLHD(1920, 1080),
    QHD(2560, 1440),
    CUSTOM(0, 0);

    private final int width;
    private final int height;

    ViewportPreset(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
