package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ProcessedFileRecord;

import java.util.List;

/**
 * An execution together with the files it newly processed.
 */
public record ExecutionDetail(ExecutionRecord execution, List<ProcessedFileRecord> processedFiles) {
    public ExecutionDetail {
        processedFiles = processedFiles != null ? List.copyOf(processedFiles) : List.of();
    }
}
