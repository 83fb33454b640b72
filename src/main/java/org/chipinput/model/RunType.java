package org.chipinput.model;

public enum RunType {
    SINGLE_ENDED("single-ended"),
    PAIRED_ENDED("paired-ended");

    private final String label;

    RunType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isPaired() {
        return this == PAIRED_ENDED;
    }
}
