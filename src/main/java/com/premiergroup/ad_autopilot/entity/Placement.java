package com.premiergroup.ad_autopilot.entity;

import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A pre-provisioned ad group registered in a directive's pool.
 */
@Entity
@Table(name = "placements",
        uniqueConstraints = @UniqueConstraint(columnNames = {"directive_id", "external_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "directive")
@ToString(exclude = "directive")
public class Placement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "directive_id", nullable = false)
    private Directive directive;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    private String name;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlacementStatus status = PlacementStatus.IDLE;

    /** Status last observed on the ad platform, refreshed by registry sync. */
    @Column(name = "external_status")
    private String externalStatus;

    @Builder.Default
    @Column(name = "usage_count", nullable = false)
    private Long usageCount = 0L;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    /** Set while an acquired placement waits for activation. */
    @Column(name = "reserved_at")
    private Instant reservedAt;

    /** Identifies the holder of the current reservation. */
    @Column(name = "reservation_token", length = 36)
    private String reservationToken;

    @Column(name = "linked_at", nullable = false)
    private Instant linkedAt;

    @Version
    private Long version;

    public void reserve(Instant at, String token) {
        reservedAt = at;
        reservationToken = token;
    }

    public boolean isReservedBy(String token) {
        return status == PlacementStatus.IDLE && token != null && token.equals(reservationToken);
    }

    public void clearReservation() {
        reservedAt = null;
        reservationToken = null;
    }

    public void markActive() {
        if (status != PlacementStatus.IDLE) {
            throw new IllegalStateException("Placement " + externalId + " cannot activate from " + status);
        }
        status = PlacementStatus.ACTIVE;
        clearReservation();
    }

    public void markIdle() {
        if (status == PlacementStatus.RETIRED) {
            throw new IllegalStateException("Placement " + externalId + " is retired");
        }
        status = PlacementStatus.IDLE;
        clearReservation();
    }

    public void markRetired() {
        status = PlacementStatus.RETIRED;
        clearReservation();
    }

    public void recordUse(Instant when) {
        usageCount = usageCount + 1;
        lastUsedAt = when;
    }
}
