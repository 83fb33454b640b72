package org.chipinput.model;

import java.util.*;

/**
 * Read-only metadata collections for one run: experiments, files, wildtype control ids and
 * the statuses a file (and its replicate) must have to be used.
 * <p>
 * Instances are shared by all workers and never mutated after construction.
 */
public final class MetadataSet {

    public static final Set<String> DEFAULT_ALLOWED_STATUSES = Set.of("released", "in progress");

    private final Map<String, ExperimentRecord> experimentsByAccession;
    private final List<FileRecord> files;
    private final Map<String, FileRecord> filesByUri;
    private final Map<String, FileRecord> filesById;
    private final Set<String> wildtypeControlIds;
    private final Set<String> allowedStatuses;

    public MetadataSet(Collection<ExperimentRecord> experiments, List<FileRecord> files,
                       Collection<String> wildtypeControlIds, Collection<String> allowedStatuses) {
        Map<String, ExperimentRecord> byAccession = new LinkedHashMap<>();
        for (ExperimentRecord e : experiments) byAccession.putIfAbsent(e.accession(), e);
        this.experimentsByAccession = Collections.unmodifiableMap(byAccession);
        this.files = List.copyOf(files);

        Map<String, FileRecord> byUri = new HashMap<>();
        Map<String, FileRecord> byId = new HashMap<>();
        for (FileRecord f : this.files) {
            if (f.uri() != null) byUri.putIfAbsent(f.uri(), f);
            if (f.id() != null) byId.putIfAbsent(f.id(), f);
        }
        this.filesByUri = Collections.unmodifiableMap(byUri);
        this.filesById = Collections.unmodifiableMap(byId);
        this.wildtypeControlIds = Set.copyOf(wildtypeControlIds);
        this.allowedStatuses = allowedStatuses == null || allowedStatuses.isEmpty()
                ? DEFAULT_ALLOWED_STATUSES : Set.copyOf(allowedStatuses);
    }

    public Optional<ExperimentRecord> experiment(String accession) {
        return Optional.ofNullable(experimentsByAccession.get(accession));
    }

    public Collection<ExperimentRecord> experiments() {
        return experimentsByAccession.values();
    }

    /** Files in catalog order. */
    public List<FileRecord> files() {
        return files;
    }

    public Optional<FileRecord> fileByUri(String uri) {
        return Optional.ofNullable(filesByUri.get(uri));
    }

    public Optional<FileRecord> fileById(String id) {
        return Optional.ofNullable(filesById.get(id));
    }

    public boolean isWildtypeControl(String datasetId) {
        return wildtypeControlIds.contains(datasetId);
    }

    public Set<String> allowedStatuses() {
        return allowedStatuses;
    }

    public boolean isUsable(FileRecord file) {
        return allowedStatuses.contains(file.status()) && allowedStatuses.contains(file.replicateStatus());
    }

    /**
     * Usable fastq files of a dataset, in catalog order.
     */
    public List<FileRecord> usableFastqsOfDataset(String datasetId) {
        List<FileRecord> result = new ArrayList<>();
        for (FileRecord f : files) {
            if (f.isFastq() && Objects.equals(datasetId, f.dataset()) && isUsable(f)) result.add(f);
        }
        return result;
    }
}
