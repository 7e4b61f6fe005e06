package com.wpanther.cgaca.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Detached signature produced by the active CA key
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureResult {
    private String keyId;
    private String algorithm;
    // Base64
    private String value;
}
