package com.wpanther.cgaca.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRenewalResponse {
    private String certificateId;
    private String verificationUrl;
}
