package com.metarwatch.core.decoder;

public enum DecodeError {
    NO_DATA("Data not available");

    private final String label;

    DecodeError(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
