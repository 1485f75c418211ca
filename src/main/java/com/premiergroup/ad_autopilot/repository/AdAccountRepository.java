package com.premiergroup.ad_autopilot.repository;

import com.premiergroup.ad_autopilot.entity.AdAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AdAccountRepository extends JpaRepository<AdAccount, Long> {

    List<AdAccount> findByAutopilotEnabledTrue();
}
