package org.chipinput.datasources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.chipinput.config.MetadataSourceItem;
import org.chipinput.model.*;
import org.chipinput.plugin.MetadataSource;
import org.chipinput.util.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads saved catalog report views (JSON documents with an {@code @graph} array) from a local directory:
 * the experiment report, the file report (fastq and bam rows) and the wildtype control search.
 * <p>
 * File links come from {@code href}, prefixed with the server URL, or from {@code s3_uri} as they are.
 */
public class PortalReportLoader implements MetadataSource {

    private static final Logger LOGGER = Logger.getLogger(PortalReportLoader.class.getName());
    private static final String GRAPH = "@graph";
    private static final String ID = "@id";
    private static final Set<String> EXCLUDED_ASSEMBLIES = Set.of("hg19", "mm9");

    private final MetadataSourceItem config;
    private final ObjectMapper mapper;
    private final String linkPrefix;
    private final String linkField;

    public PortalReportLoader(MetadataSourceItem config) {
        this(config, new ObjectMapper());
    }

    PortalReportLoader(MetadataSourceItem config, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "Metadata source configuration cannot be null");
        this.mapper = Objects.requireNonNull(mapper);
        if (config.isUseS3Uris()) {
            this.linkPrefix = "";
            this.linkField = "s3_uri";
        } else {
            this.linkPrefix = Utils.stripTrailingSlash(config.server());
            this.linkField = "href";
        }
    }

    @Override
    public MetadataSet load(Collection<String> accessions) throws IOException {
        final Set<String> wanted = new HashSet<>(accessions);

        final List<ExperimentRecord> experiments = new ArrayList<>();
        for (JsonNode node : readGraph(config.experimentReport())) {
            String accession = text(node, "accession");
            if (accession != null && wanted.contains(accession)) experiments.add(toExperiment(node));
        }
        experiments.sort(Comparator.comparing(ExperimentRecord::accession));
        LOGGER.info(String.format("Loaded %d of %d requested experiments.", experiments.size(), wanted.size()));

        final Set<String> datasets = new HashSet<>();
        for (ExperimentRecord e : experiments) {
            datasets.add(e.id());
            datasets.addAll(e.possibleControls());
        }

        final List<FileRecord> files = new ArrayList<>();
        for (JsonNode node : readGraph(config.fileReport())) {
            FileRecord file = toFile(node);
            if (file == null || !datasets.contains(file.dataset())) continue;
            files.add(file);
        }
        LOGGER.info(String.format("Loaded %d files for %d datasets.", files.size(), datasets.size()));

        final List<String> wildtypeIds = new ArrayList<>();
        Path wildtypePath = config.reportDir().resolve(config.wildtypeControlReport());
        if (Files.isRegularFile(wildtypePath)) {
            for (JsonNode node : readGraph(config.wildtypeControlReport())) {
                String id = text(node, ID);
                if (id != null) wildtypeIds.add(id);
            }
        } else {
            LOGGER.warning("No wildtype control report at " + wildtypePath + "; eGFP experiments with several controls will fail.");
        }

        return new MetadataSet(experiments, files, wildtypeIds, config.allowedStatuses());
    }

    private List<JsonNode> readGraph(String reportName) throws IOException {
        Path path = config.reportDir().resolve(reportName);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Metadata report not found: " + path.toAbsolutePath());
        }
        JsonNode root = mapper.readTree(path.toFile());
        JsonNode graph = root.isArray() ? root : root.path(GRAPH);
        if (!graph.isArray()) {
            throw new IOException("Metadata report " + path + " has no " + GRAPH + " array.");
        }
        List<JsonNode> nodes = new ArrayList<>(graph.size());
        graph.forEach(nodes::add);
        return nodes;
    }

    ExperimentRecord toExperiment(JsonNode node) {
        List<ReplicateRecord> replicates = new ArrayList<>();
        for (JsonNode rep : node.path("replicates")) {
            List<String> targets = null;
            JsonNode antibody = rep.get("antibody");
            if (antibody != null && !antibody.isNull()) {
                targets = new ArrayList<>();
                for (JsonNode target : antibody.path("targets")) {
                    String t = target.isObject() ? text(target, ID) : target.asText(null);
                    if (t != null) targets.add(t);
                }
            }
            String organism = text(rep.path("library").path("biosample").path("organism"), "scientific_name");
            replicates.add(new ReplicateRecord(targets, organism));
        }

        List<String> fileUris = new ArrayList<>();
        for (JsonNode f : node.path("files")) {
            String link = text(f, linkField);
            if (link != null) fileUris.add(linkPrefix + link);
        }

        List<String> controls = new ArrayList<>();
        for (JsonNode c : node.path("possible_controls")) {
            String id = c.isObject() ? text(c, ID) : c.asText(null);
            if (id != null) controls.add(id);
        }

        return new ExperimentRecord(text(node, ID), text(node, "accession"), text(node, "assay_title"),
                text(node, "control_type"), replicates, fileUris, controls);
    }

    FileRecord toFile(JsonNode node) {
        String link = text(node, linkField);
        if (link == null) {
            LOGGER.log(Level.FINE, "File {0} has no {1}, skipped.", new Object[]{text(node, ID), linkField});
            return null;
        }
        String assembly = text(node, "assembly");
        if (assembly != null && EXCLUDED_ASSEMBLIES.contains(assembly)) return null;

        JsonNode reps = node.path("biological_replicates");
        Integer biorep = reps.isArray() && reps.size() > 0 ? integer(reps.get(0)) : integer(reps);

        String replicateStatus = text(node.path("replicate"), "status");
        if (replicateStatus == null) replicateStatus = text(node, "replicate.status");

        return new FileRecord(
                text(node, ID),
                linkPrefix + link,
                text(node, "dataset"),
                FileFormat.fromLabel(text(node, "file_format")),
                text(node, "status"),
                replicateStatus,
                biorep,
                text(node, "paired_end"),
                text(node, "paired_with"),
                text(node, "run_type"),
                integer(node.get("read_length")),
                text(node, "mapped_run_type"),
                integer(node.get("cropped_read_length")),
                integer(node.get("cropped_read_length_tolerance")));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        return value.asText();
    }

    private static Integer integer(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isNumber()) return value.intValue();
        return Utils.parseInteger(value.asText());
    }
}
