package org.chipinput.processing;

import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one resolution stage: either a value or the error that stops the experiment.
 */
public final class Resolution<T> {

    private final T value;
    private final ErrorRecord error;

    private Resolution(T value, ErrorRecord error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Resolution<T> success(T value) {
        return new Resolution<>(Objects.requireNonNull(value), null);
    }

    public static <T> Resolution<T> failure(String accession, ErrorTag tag, String message) {
        return new Resolution<>(null, ErrorRecord.of(accession, tag, message));
    }

    public static <T> Resolution<T> failure(ErrorRecord error) {
        return new Resolution<>(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) throw new IllegalStateException("No value, stage failed with " + error.tags());
        return value;
    }

    public ErrorRecord error() {
        if (error == null) throw new IllegalStateException("Stage succeeded, there is no error");
        return error;
    }

    public List<ErrorTag> tags() {
        return error == null ? List.of() : error.tags();
    }

    @Override
    public String toString() {
        return error == null ? "Resolution[" + value + "]" : "Resolution[" + error.tags() + "]";
    }
}
