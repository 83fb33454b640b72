package org.chipinput.config;

import java.nio.file.Path;

/**
 * Output settings. {@code gcPath} is where the input JSONs will be uploaded; it only affects the
 * generated caper commands.
 */
public record OutputItem(Path outputDir, String wdlPath, String gcPath, String commandsFileMessage) {
    public OutputItem {
        if (outputDir == null) outputDir = Path.of(".");
        if (wdlPath == null) wdlPath = "chip.wdl";
        if (gcPath == null) gcPath = "";
        if (commandsFileMessage == null) commandsFileMessage = "";
    }
}
