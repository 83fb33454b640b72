package org.chipinput.processing;

import org.chipinput.config.OutputItem;
import org.chipinput.model.ChipInputConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the shell script that submits every written pipeline input to caper.
 */
public class CaperCommandBuilder {

    private static final Logger LOGGER = Logger.getLogger(CaperCommandBuilder.class.getName());

    private final OutputItem output;

    public CaperCommandBuilder(OutputItem output) {
        this.output = output;
    }

    /**
     * {@code caper submit <wdl> -i <gcPath>/<description>.json -s <description>[_<message>]}, followed
     * by a one-second sleep.
     */
    public String command(ChipInputConfig config) {
        String label = config.description();
        if (config.customMessage() != null && !config.customMessage().isEmpty()) {
            label += "_" + config.customMessage();
        }
        return String.format("caper submit %s -i %s%s.json -s %s\nsleep 1\n",
                output.wdlPath(), inputPrefix(), config.description(), label);
    }

    public String script(Collection<ChipInputConfig> configs) {
        StringBuilder sb = new StringBuilder();
        for (ChipInputConfig config : configs) sb.append(command(config));
        return sb.toString();
    }

    public Path scriptPath() {
        String message = output.commandsFileMessage();
        String name = message.isEmpty() ? "caper_submit.sh" : "caper_submit_" + message + ".sh";
        return output.outputDir().resolve(name);
    }

    /**
     * Writes the script unless there is nothing to submit.
     */
    public Optional<Path> write(Collection<ChipInputConfig> configs) throws IOException {
        if (configs.isEmpty()) {
            LOGGER.info("No experiments configured, no caper script written.");
            return Optional.empty();
        }
        Files.createDirectories(output.outputDir());
        Path target = scriptPath();
        Files.writeString(target, script(configs));
        LOGGER.info("Wrote caper commands to " + target.toAbsolutePath());
        return Optional.of(target);
    }

    private String inputPrefix() {
        String gcPath = output.gcPath();
        if (gcPath.isEmpty()) return "";
        return gcPath.endsWith("/") ? gcPath : gcPath + "/";
    }
}
