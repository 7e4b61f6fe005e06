package com.wpanther.cgaca.dto.verification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a live agent reports about itself
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveAgentState {
    // Hash of the governance document the agent is running with
    private String goldenThreadHash;
    @Builder.Default
    private List<ProbeCheck> checks = new ArrayList<>();
}
