package com.largomodo.bayalloc.service;

import com.largomodo.bayalloc.core.domain.InputDataset;

import java.io.IOException;

/**
 * Loads the client exports into an in-memory dataset.
 */
public interface InputReader {

    /**
     * @param sources files to read
     * @return parsed dataset with malformed rows already dropped
     * @throws InputDataException if a file is missing, empty or lacks a required column
     * @throws IOException        if a file cannot be read
     */
    InputDataset read(InputSources sources) throws IOException;
}
