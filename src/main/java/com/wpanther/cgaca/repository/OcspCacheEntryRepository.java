package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.OcspCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface OcspCacheEntryRepository extends JpaRepository<OcspCacheEntry, String> {

    /**
     * Remove entries whose validity window has closed
     */
    @Modifying
    @Query("DELETE FROM OcspCacheEntry e WHERE e.nextUpdate <= :now")
    int deleteByNextUpdateNotAfter(@Param("now") Instant now);
}
