package org.chipinput.config;

import org.chipinput.util.Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Reads the tab-separated request table: a header row naming the columns, then one experiment per line.
 * <p>
 * Required columns are {@code accession} and {@code align_only}; {@code custom_message},
 * {@code custom_crop_length}, {@code multiple_controls}, {@code force_se} and {@code redacted} are optional.
 * Requests come back sorted by accession, duplicates dropped (first row wins).
 */
public class RequestTableParser {

    private static final Logger LOGGER = Logger.getLogger(RequestTableParser.class.getName());

    static final String ACCESSION = "accession";
    static final String ALIGN_ONLY = "align_only";
    static final String CUSTOM_MESSAGE = "custom_message";
    static final String CUSTOM_CROP_LENGTH = "custom_crop_length";
    static final String MULTIPLE_CONTROLS = "multiple_controls";
    static final String FORCE_SE = "force_se";
    static final String REDACTED = "redacted";

    public List<ExperimentRequest> parse(Path requestFile) throws IOException {
        if (!Files.isRegularFile(requestFile)) {
            throw new IOException("Request table not found: " + requestFile.toAbsolutePath());
        }
        return parse(Files.readAllLines(requestFile, StandardCharsets.UTF_8), requestFile.toString());
    }

    List<ExperimentRequest> parse(List<String> lines, String source) {
        Iterator<String> it = lines.stream().filter(l -> !l.isBlank()).iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException("Request table " + source + " is empty.");
        }
        Map<String, Integer> header = parseHeader(it.next());
        for (String required : List.of(ACCESSION, ALIGN_ONLY)) {
            if (!header.containsKey(required)) {
                throw new IllegalArgumentException("Missing required " + required + " column in request table " + source);
            }
        }

        Map<String, ExperimentRequest> requests = new TreeMap<>();
        int lineNo = 1;
        while (it.hasNext()) {
            lineNo++;
            String[] cells = it.next().split("\t", -1);
            String accession = cell(cells, header, ACCESSION);
            if (Utils.isBlank(accession)) {
                LOGGER.warning(String.format("%s line %d: no accession, row skipped.", source, lineNo));
                continue;
            }
            accession = accession.trim();
            if (requests.containsKey(accession)) {
                LOGGER.warning(String.format("%s line %d: duplicate accession %s ignored.", source, lineNo, accession));
                continue;
            }
            try {
                requests.put(accession, new ExperimentRequest(
                        accession,
                        flag(cells, header, ALIGN_ONLY),
                        Optional.ofNullable(cell(cells, header, CUSTOM_MESSAGE)).filter(m -> !Utils.isBlank(m)).map(String::trim).orElse(""),
                        Utils.parseInteger(cell(cells, header, CUSTOM_CROP_LENGTH)),
                        flag(cells, header, MULTIPLE_CONTROLS),
                        flag(cells, header, FORCE_SE),
                        flag(cells, header, REDACTED)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format("%s line %d: %s", source, lineNo, e.getMessage()), e);
            }
        }
        return new ArrayList<>(requests.values());
    }

    private static Map<String, Integer> parseHeader(String line) {
        Map<String, Integer> header = new HashMap<>();
        String[] names = line.split("\t", -1);
        for (int i = 0; i < names.length; i++) {
            header.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return header;
    }

    private static String cell(String[] cells, Map<String, Integer> header, String column) {
        Integer idx = header.get(column);
        return idx == null || idx >= cells.length ? null : cells[idx];
    }

    private static boolean flag(String[] cells, Map<String, Integer> header, String column) {
        return Boolean.TRUE.equals(Utils.parseBoolean(cell(cells, header, column)));
    }
}
