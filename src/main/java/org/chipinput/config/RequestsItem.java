package org.chipinput.config;

import java.nio.file.Path;

public record RequestsItem(Path requestFile) {
    public RequestsItem {
        if (requestFile == null) requestFile = Path.of("requests.tsv");
    }
}
