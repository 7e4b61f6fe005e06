package com.wpanther.cgaca.dto.verification;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveVerificationResult {
    private String certificateId;
    private String agentId;
    private LiveVerificationOutcome outcome;
    private String details;
    private List<ProbeCheck> checks;
    private Instant timestamp;
    private long durationMs;
    private boolean autoRevoked;

    public boolean isPassed() {
        return outcome == LiveVerificationOutcome.VALID;
    }
}
