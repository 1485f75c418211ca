package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MetricSnapshotRepository extends JpaRepository<MetricSnapshot, Long> {

    Optional<MetricSnapshot> findByAccountIdAndPlacementIdAndStatsDate(Long accountId, String placementId, LocalDate statsDate);

    List<MetricSnapshot> findByAccountIdAndPlacementIdInAndStatsDateBetween(
            Long accountId,
            Collection<String> placementIds,
            LocalDate start,
            LocalDate end
    );

    boolean existsByAccountIdAndPlacementIdAndStatsDateAfter(Long accountId, String placementId, LocalDate statsDate);

    @Modifying
    @Query("delete from MetricSnapshot m where m.statsDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
