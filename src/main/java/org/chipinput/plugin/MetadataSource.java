package org.chipinput.plugin;

import org.chipinput.model.MetadataSet;

import java.io.IOException;
import java.util.Collection;

/**
 * Supplies the metadata collections for one run.
 */
public interface MetadataSource {
    /**
     * Loads the experiments named by {@code accessions}, the files of those experiments and of
     * their possible controls, and the wildtype control ids.
     *
     * @throws IOException If the metadata cannot be read. Missing experiments are not an error here.
     */
    MetadataSet load(Collection<String> accessions) throws IOException;
}
