package com.wpanther.cgaca.dto;

import com.wpanther.cgaca.entity.CgaLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SigningRequest {

    @NotBlank(message = "Agent ID is required")
    @Size(max = 255, message = "Agent ID must be at most 255 characters")
    private String agentId;

    @NotBlank(message = "Agent version is required")
    @Size(max = 255, message = "Agent version must be at most 255 characters")
    private String agentVersion;

    @NotBlank(message = "Organization ID is required")
    @Size(max = 255, message = "Organization ID must be at most 255 characters")
    private String organizationId;

    @NotBlank(message = "Organization name is required")
    private String organizationName;

    private String organizationDomain;

    @NotNull(message = "Certification level is required")
    private CgaLevel level;

    // The governance document being attested; its canonical hash becomes the golden thread
    @NotEmpty(message = "Attested content is required")
    private Map<String, Object> attestedContent;

    // Overrides the level's default validity
    @Positive(message = "Validity days must be positive")
    private Integer validityDays;

    // Set only when this issuance replaces the current certificate of the same identity
    private String supersedesCertificateId;

    // Actor string such as "api", "system" or "admin:alice"
    private String requestedBy;
}
