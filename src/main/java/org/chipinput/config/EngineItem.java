package org.chipinput.config;

public record EngineItem(Integer numThreads) {
    public EngineItem {
        if (numThreads == null || numThreads < 1) numThreads = Runtime.getRuntime().availableProcessors();
    }
}
