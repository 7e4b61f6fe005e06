package com.wpanther.cgaca.dto.ocsp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcspRequest {
    private List<String> certificateIds;
    // Echoed back to bind the response to this request
    private String nonce;
}
