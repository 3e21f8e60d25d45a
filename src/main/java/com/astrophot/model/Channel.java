package com.astrophot.model;

public enum Channel {
    R("r", 0),
    G("g", 1),
    B("b", 2),
    GRAY("gray", -1);

    private final String prefix;
    private final int planeIndex;

    Channel(String prefix, int planeIndex) {
        this.prefix = prefix;
        this.planeIndex = planeIndex;
    }

    public String prefix() { return prefix; }

    // Índice del plano en un frame RGB; -1 para el gris derivado
    public int planeIndex() { return planeIndex; }

    public boolean isColor() { return planeIndex >= 0; }
}
