package com.wpanther.cgaca.dto.ocsp;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Signed batch of single responses.
 * The signature covers the canonical JSON of producedAt, responses and nonce.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OcspResponse {
    private OcspResponseStatus responseStatus;
    private Instant producedAt;
    private List<SingleResponse> responses;
    private String nonce;
    private String signatureAlgorithm;
    private String signatureKeyId;
    private String signature;
}
