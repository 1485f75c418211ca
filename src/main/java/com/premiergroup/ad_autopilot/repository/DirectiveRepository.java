package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.Directive;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DirectiveRepository extends JpaRepository<Directive, Long> {

    List<Directive> findByAccount_IdAndIsActiveTrue(Long accountId);

    Optional<Directive> findByIdAndAccount_Id(Long id, Long accountId);

    boolean existsByAccount_IdAndExternalCampaignId(Long accountId, String externalCampaignId);
}
