package org.chipinput.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Error report entry for one excluded experiment. Tags keep the order they were raised in and
 * never repeat.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorRecord(String accession, List<ErrorTag> tags, List<String> messages) {

    public ErrorRecord {
        Objects.requireNonNull(accession, "accession");
        tags = List.copyOf(new LinkedHashSet<>(tags));
        if (tags.isEmpty()) throw new IllegalArgumentException("An error record needs at least one tag: " + accession);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ErrorRecord of(String accession, ErrorTag tag, String message) {
        return new ErrorRecord(accession, List.of(tag), message == null ? List.of() : List.of(message));
    }

    public boolean hasTag(ErrorTag tag) {
        return tags.contains(tag);
    }

    public ErrorRecord merge(ErrorRecord other) {
        if (!accession.equals(other.accession)) {
            throw new IllegalArgumentException("Cannot merge errors of " + accession + " and " + other.accession);
        }
        List<ErrorTag> mergedTags = new ArrayList<>(tags);
        mergedTags.addAll(other.tags);
        List<String> mergedMessages = new ArrayList<>(messages);
        mergedMessages.addAll(other.messages);
        return new ErrorRecord(accession, mergedTags, mergedMessages);
    }
}
