package com.premiergroup.ad_autopilot.entity;

import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.enums.TriggerOrigin;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "dispatch_batches",
        uniqueConstraints = @UniqueConstraint(name = "uk_dispatch_batches_idempotency_key",
                columnNames = "idempotency_key"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "results")
@ToString(exclude = "results")
public class DispatchBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TriggerOrigin origin;

    @Builder.Default
    @Column(name = "dry_run", nullable = false)
    private Boolean dryRun = Boolean.FALSE;

    @Column(name = "mutation_count", nullable = false)
    private Integer mutationCount;

    /** Proposed mutations as received, for audit. */
    @Column(name = "request_json", columnDefinition = "text")
    private String requestJson;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Builder.Default
    @OneToMany(mappedBy = "batch", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("mutationIndex ASC")
    private List<MutationResult> results = new ArrayList<>();

    public void addResult(MutationResult result) {
        result.setBatch(this);
        results.add(result);
    }
}
