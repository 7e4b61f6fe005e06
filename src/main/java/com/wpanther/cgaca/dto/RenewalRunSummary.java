package com.wpanther.cgaca.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Totals of a renewal sweep
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenewalRunSummary {

    private Instant startedAt;
    private Instant finishedAt;
    private int candidates;
    private int succeeded;
    private int failed;
    private int skipped;
    private List<RenewalResult> results;

    /**
     * Process exit status for an on-demand run: non-zero only if a candidate failed
     */
    public int exitCode() {
        return failed > 0 ? 1 : 0;
    }
}
