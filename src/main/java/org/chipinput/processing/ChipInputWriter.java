package org.chipinput.processing;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.chipinput.model.ChipInputConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes one pipeline input JSON per configured experiment, named after its description.
 */
public class ChipInputWriter {

    private static final Logger LOGGER = Logger.getLogger(ChipInputWriter.class.getName());

    private final Path outputDir;
    private final ObjectWriter writer;

    public ChipInputWriter(Path outputDir) {
        this.outputDir = outputDir;
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        this.writer = new ObjectMapper().writer(printer);
    }

    public Path write(ChipInputConfig config) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(config.description() + ".json");
        Files.writeString(target, writer.writeValueAsString(config.toInputJson()));
        return target;
    }

    public List<Path> writeAll(Collection<ChipInputConfig> configs) throws IOException {
        List<Path> written = new ArrayList<>(configs.size());
        for (ChipInputConfig config : configs) written.add(write(config));
        LOGGER.info(String.format("Wrote %d pipeline input files to %s", written.size(), outputDir.toAbsolutePath()));
        return written;
    }
}
