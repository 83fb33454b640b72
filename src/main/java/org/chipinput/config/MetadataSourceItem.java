package org.chipinput.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Where the saved catalog reports live and how file links are built from them.
 */
public record MetadataSourceItem(Path reportDir, String experimentReport, String fileReport,
                                 String wildtypeControlReport, String server, @JsonProperty("useS3Uris") Boolean useS3Uris,
                                 List<String> allowedStatuses) {
    public MetadataSourceItem {
        if (reportDir == null) reportDir = Path.of("metadata");
        if (experimentReport == null) experimentReport = "experiments.json";
        if (fileReport == null) fileReport = "files.json";
        if (wildtypeControlReport == null) wildtypeControlReport = "wildtype_controls.json";
        if (server == null) server = "https://www.encodeproject.org";
        if (useS3Uris == null) useS3Uris = false;
        if (allowedStatuses == null || allowedStatuses.isEmpty()) allowedStatuses = List.of("released", "in progress");
    }

    public boolean isUseS3Uris() {
        return useS3Uris != null && useS3Uris;
    }
}
