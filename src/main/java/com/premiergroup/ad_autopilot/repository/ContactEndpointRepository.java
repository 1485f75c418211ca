package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.ContactEndpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ContactEndpointRepository extends JpaRepository<ContactEndpoint, Long> {

    Optional<ContactEndpoint> findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(Long accountId);

    List<ContactEndpoint> findByAccount_IdAndIsDefaultTrue(Long accountId);

    List<ContactEndpoint> findByAccount_IdOrderByIdAsc(Long accountId);

    Optional<ContactEndpoint> findByIdAndAccount_Id(Long id, Long accountId);

    boolean existsByAccount_IdAndValue(Long accountId, String value);
}
