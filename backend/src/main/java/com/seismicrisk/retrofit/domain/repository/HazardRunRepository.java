package com.seismicrisk.retrofit.domain.repository;

import com.seismicrisk.retrofit.domain.model.HazardRun;
import com.seismicrisk.retrofit.domain.model.HazardRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface HazardRunRepository extends JpaRepository<HazardRun, Long> {

    Optional<HazardRun> findByCacheKey(String cacheKey);

    /**
     * Find runs in a given state, oldest first.
     */
    List<HazardRun> findByStatusOrderByStartedAtAsc(HazardRunStatus status);

    List<HazardRun> findAllByOrderByStartedAtDesc();

    /**
     * Record a cache hit without loading the row.
     */
    @Modifying
    @Transactional
    @Query("UPDATE HazardRun hr SET hr.reuseCount = hr.reuseCount + 1 WHERE hr.cacheKey = :cacheKey")
    int incrementReuseCount(@Param("cacheKey") String cacheKey);

    long countByStatus(HazardRunStatus status);
}
