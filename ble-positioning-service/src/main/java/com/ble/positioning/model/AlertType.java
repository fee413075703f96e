package com.ble.positioning.model;

/** Kind of zone alert. */
public enum AlertType {
    ENTRY("entry"),
    EXIT("exit"),
    DWELL("dwell");

    private final String label;

    AlertType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
