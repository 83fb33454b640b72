package org.chipinput.metrics;

public interface HasStatus {
    Status status();
}
