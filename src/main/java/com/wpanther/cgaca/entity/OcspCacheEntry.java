package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached single response for one certificate, keyed by certificate id.
 * Only usable while now is within [thisUpdate, nextUpdate).
 */
@Entity
@Table(name = "ocsp_cache")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcspCacheEntry {

    @Id
    @Column(name = "certificate_id")
    private String certificateId;

    @Column(name = "cert_status", nullable = false, length = 16)
    private String certStatus;

    @Lob
    @Column(name = "response_bytes", nullable = false)
    private byte[] responseBytes;

    @Column(name = "produced_at", nullable = false)
    private Instant producedAt;

    @Column(name = "this_update", nullable = false)
    private Instant thisUpdate;

    @Column(name = "next_update", nullable = false)
    private Instant nextUpdate;

    public boolean isValidAt(Instant now) {
        return !now.isBefore(thisUpdate) && now.isBefore(nextUpdate);
    }
}
