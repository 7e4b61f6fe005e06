package com.wpanther.cgaca.dto.verification;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named check run against a live agent, e.g. kill_switch or health_endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProbeCheck {
    private String name;
    private boolean passed;
    private Long latencyMs;
    private String error;
}
