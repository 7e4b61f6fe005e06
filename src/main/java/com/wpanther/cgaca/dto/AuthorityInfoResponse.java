package com.wpanther.cgaca.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthorityInfoResponse {
    private String issuerId;
    private String issuerName;
    private String keyId;
    private String keyAlgorithm;
    private String signatureAlgorithm;
    private String publicKeyPem;
    private List<String> supportedLevels;
}
