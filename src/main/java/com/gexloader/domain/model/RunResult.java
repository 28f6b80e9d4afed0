package com.gexloader.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Summary of one loader run, logged at the end and returned to the runner.
 */
@Data
@Builder
public class RunResult {

    public enum Outcome {
        WRITTEN,
        NO_DATA
    }

    private String ticker;
    private LocalDate sourceDate;
    private LocalDate storedDate;
    private Outcome outcome;

    /** Records returned by the provider within the DTE limit. */
    private int fetched;

    /** Records skipped because they failed to build or lacked a key field. */
    private int dropped;

    private int written;
    private long durationMs;
}
