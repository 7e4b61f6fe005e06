package com.wpanther.cgaca.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "schema_version")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaVersion {

    @Id
    private Integer version;

    @Column(name = "applied_at", nullable = false)
    private Instant appliedAt;
}
