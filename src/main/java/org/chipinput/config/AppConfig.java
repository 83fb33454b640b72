package org.chipinput.config;

public record AppConfig(MetadataSourceItem metadata, RequestsItem requests, OutputItem output, EngineItem engine) {
    public AppConfig {
        if (metadata == null) metadata = new MetadataSourceItem(null, null, null, null, null, null, null);
        if (requests == null) requests = new RequestsItem(null);
        if (output == null) output = new OutputItem(null, null, null, null);
        if (engine == null) engine = new EngineItem(null);
    }
}
