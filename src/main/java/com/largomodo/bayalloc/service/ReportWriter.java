package com.largomodo.bayalloc.service;

import com.largomodo.bayalloc.core.PipelineResult;
import com.largomodo.bayalloc.core.domain.InputDataset;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes the outcome of one run.
 */
public interface ReportWriter {

    /**
     * @param result     pipeline outcome
     * @param dataset    inputs the outcome was computed from
     * @param outputRoot directory under which the report is created
     * @return directory holding the written report
     * @throws IOException if any file cannot be written
     */
    Path write(PipelineResult result, InputDataset dataset, Path outputRoot) throws IOException;
}
