package com.premiergroup.ad_autopilot.entity;

import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationOutcome;
import com.premiergroup.ad_autopilot.enums.MutationType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "mutation_results",
        uniqueConstraints = @UniqueConstraint(columnNames = {"batch_id", "mutation_index"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "batch")
@ToString(exclude = "batch")
public class MutationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_id", nullable = false, updatable = false)
    private DispatchBatch batch;

    @Column(name = "mutation_index", nullable = false, updatable = false)
    private Integer mutationIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "mutation_type", updatable = false)
    private MutationType mutationType;

    @Column(name = "target_ref", updatable = false)
    private String targetRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private MutationOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", updatable = false)
    private ErrorCode errorCode;

    @Column(name = "error_message", length = 2000, updatable = false)
    private String errorMessage;

    /** Opaque payload returned by the ad platform. */
    @Column(name = "response_payload", columnDefinition = "text", updatable = false)
    private String responsePayload;
}
