package com.premiergroup.ad_autopilot.service.loop;

import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Daily trigger. Accounts run concurrently on the control-loop pool; a failing
 * account is logged and does not hold up the others.
 */
@Component
@Log4j2
public class ControlLoopScheduler {

    private final AdAccountRepository accountRepository;
    private final ControlLoopService controlLoopService;
    private final ExecutorService controlLoopExecutor;

    public ControlLoopScheduler(AdAccountRepository accountRepository,
                                ControlLoopService controlLoopService,
                                @Qualifier("controlLoopExecutor") ExecutorService controlLoopExecutor) {
        this.accountRepository = accountRepository;
        this.controlLoopService = controlLoopService;
        this.controlLoopExecutor = controlLoopExecutor;
    }

    @Scheduled(cron = "${autopilot.schedule.control-loop-cron:0 0 6 * * *}", zone = "${autopilot.schedule.zone:UTC}")
    public void dailyRun() {
        List<AdAccount> accounts = accountRepository.findByAutopilotEnabledTrue();
        log.info("Starting scheduled control loop for {} accounts", accounts.size());

        List<CompletableFuture<Boolean>> runs = accounts.stream()
                .map(account -> CompletableFuture.supplyAsync(() -> runOne(account), controlLoopExecutor))
                .toList();
        long succeeded = runs.stream().filter(CompletableFuture::join).count();

        log.info("Completed scheduled control loop: {} of {} accounts succeeded", succeeded, accounts.size());
    }

    private boolean runOne(AdAccount account) {
        try {
            ExecutionReport report = controlLoopService.runScheduled(account.getId());
            log.info("Account {} finished with {}", account.getId(), report.status());
            return true;
        } catch (Exception ex) {
            log.error("Control loop failed for account {}", account.getId(), ex);
            return false;
        }
    }
}
