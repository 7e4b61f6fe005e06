package com.wpanther.cgaca.dto.ocsp;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Status of one certificate, valid from thisUpdate until nextUpdate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SingleResponse {
    private String certificateId;
    private OcspCertStatus certStatus;
    private Instant thisUpdate;
    private Instant nextUpdate;
    private Instant revocationTime;
    private String revocationReason;
}
