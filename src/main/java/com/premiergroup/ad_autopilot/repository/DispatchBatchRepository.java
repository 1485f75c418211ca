package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.DispatchBatch;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DispatchBatchRepository extends JpaRepository<DispatchBatch, Long> {

    @EntityGraph(attributePaths = "results")
    Optional<DispatchBatch> findByIdempotencyKey(String idempotencyKey);
}
