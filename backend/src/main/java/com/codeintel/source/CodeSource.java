package com.codeintel.source;

import java.io.IOException;

/**
 * Supplies raw code rows to the index. Implementations hide how the dataset is laid out on disk.
 */
public interface CodeSource {

    /**
     * Read every record. Called once per load.
     *
     * @throws IOException if a file is missing or is not valid JSON
     */
    CodeBatch read() throws IOException;

    /**
     * Human-readable origin for log messages.
     */
    String describe();
}
