package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.SchemaVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SchemaVersionRepository extends JpaRepository<SchemaVersion, Integer> {

    @Query("SELECT MAX(s.version) FROM SchemaVersion s")
    Optional<Integer> findCurrentVersion();
}
