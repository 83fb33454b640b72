package org.chipinput.processing;

import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.stream.Collectors;

import static org.chipinput.util.Utils.escapeCsvField;

/**
 * Writes the excluded experiments as CSV: accession, tags separated by {@code ;}, messages.
 */
public class ErrorReportWriter {

    public static final String FILE_NAME = "errors.csv";
    static final String HEADER = "accession,tags,message\n";

    private final Path outputDir;

    public ErrorReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path write(Collection<ErrorRecord> errors) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(FILE_NAME);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            for (ErrorRecord error : errors) {
                writer.write(toCsv(error));
            }
        }
        return target;
    }

    static String toCsv(ErrorRecord error) {
        String tags = error.tags().stream().map(ErrorTag::name).collect(Collectors.joining(";"));
        return escapeCsvField(error.accession()) + "," + tags + "," + escapeCsvField(String.join(" ", error.messages())) + "\n";
    }
}
