package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PlacementRepository extends JpaRepository<Placement, Long> {

    List<Placement> findByDirective_IdOrderByStatusAscLinkedAtDesc(Long directiveId);

    List<Placement> findByDirective_Account_Id(Long accountId);

    Optional<Placement> findByDirective_IdAndExternalId(Long directiveId, String externalId);

    Optional<Placement> findFirstByDirective_Account_IdAndExternalId(Long accountId, String externalId);

    Optional<Placement> findByIdAndDirective_Id(Long id, Long directiveId);

    long countByDirective_IdAndStatus(Long directiveId, PlacementStatus status);

    /**
     * Idle placements free for allocation, least used first, then least recently used.
     */
    @Query("""
            select p from Placement p
            where p.directive.id = :directiveId
              and p.status = com.premiergroup.ad_autopilot.enums.PlacementStatus.IDLE
              and (p.reservedAt is null or p.reservedAt < :reservationCutoff)
            order by p.usageCount asc,
                     case when p.lastUsedAt is null then 0 else 1 end asc,
                     p.lastUsedAt asc,
                     p.id asc
            """)
    List<Placement> findAllocatable(@Param("directiveId") Long directiveId,
                                    @Param("reservationCutoff") Instant reservationCutoff);
}
