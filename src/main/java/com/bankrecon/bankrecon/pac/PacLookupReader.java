package com.bankrecon.bankrecon.pac;

import java.nio.file.Path;

/**
 * Abstraction for loading the PAC export from any backing format.
 */
public interface PacLookupReader {

    /**
     * Reads the whole export and returns its normalized records.
     *
     * @throws IllegalStateException when the export cannot be read or lacks a required column
     */
    PacLookupTable read(Path pacFile);
}
