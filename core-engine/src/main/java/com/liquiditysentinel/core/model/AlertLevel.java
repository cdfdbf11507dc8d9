package com.liquiditysentinel.core.model;

/**
 * Alert severity, with the display label and colour used by presentation
 * layers.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    GREEN("Green", "#22c55e"),
    YELLOW("Yellow", "#f59e0b"),
    RED("Red", "#ef4444");

    private final String label;
    private final String color;

    AlertLevel(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }
}
