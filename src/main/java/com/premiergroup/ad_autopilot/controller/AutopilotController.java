package com.premiergroup.ad_autopilot.controller;

import com.premiergroup.ad_autopilot.dto.DispatchRequest;
import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.service.loop.ControlLoopService;
import com.premiergroup.ad_autopilot.service.metrics.MetricsCollectionJob;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/autopilot")
@RequiredArgsConstructor
@Validated
public class AutopilotController {

    private final ControlLoopService controlLoopService;
    private final MetricsCollectionJob metricsCollectionJob;
    private final AdAccountRepository accountRepository;

    /**
     * Manual re-run of the control loop for one account.
     * <p>
     * Example: POST api/autopilot/accounts/7/run?dryRun=true
     */
    @PostMapping("/accounts/{accountId}/run")
    public ResponseEntity<ExecutionReport> runAccount(
            @PathVariable @Positive Long accountId,
            @RequestParam(required = false) Boolean dryRun,
            @RequestParam(required = false) String idempotencyKey
    ) {
        return ResponseEntity.ok(controlLoopService.runManual(accountId, dryRun, idempotencyKey));
    }

    @PostMapping("/dispatch")
    public ResponseEntity<ExecutionReport> dispatch(@Valid @RequestBody DispatchRequest request) {
        ExecutionReport report = controlLoopService.dispatch(request);
        if (report.batchId() == null && report.status() == BatchStatus.REJECTED) {
            return ResponseEntity.unprocessableEntity().body(report);
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping("/batches/{idempotencyKey}")
    public ResponseEntity<ExecutionReport> getBatch(@PathVariable String idempotencyKey) {
        return controlLoopService.findReport(idempotencyKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Pulls one day of placement metrics for an account into the store.
     * <p>
     * Example: POST api/autopilot/accounts/7/metrics/sync?date=2024-05-01
     */
    @PostMapping("/accounts/{accountId}/metrics/sync")
    public ResponseEntity<Map<String, Object>> syncMetrics(
            @PathVariable @Positive Long accountId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        AdAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));
        int stored = metricsCollectionJob.collect(account, date);
        return ResponseEntity.ok(Map.of("accountId", accountId, "date", date, "snapshots", stored));
    }
}
