package com.premiergroup.ad_autopilot.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "metric_snapshots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"account_id", "placement_id", "stats_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class MetricSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    /** External id of the placement. */
    @Column(name = "placement_id", nullable = false)
    private String placementId;

    @Column(name = "stats_date", nullable = false)
    private LocalDate statsDate;

    private Long impressions;
    private Long clicks;
    private Long linkClicks;
    private Long conversions;

    @Column(precision = 19, scale = 2)
    private BigDecimal spend;

    @Column(precision = 19, scale = 4)
    private BigDecimal ctr;

    @Column(precision = 19, scale = 4)
    private BigDecimal cpm;

    @Column(precision = 19, scale = 4)
    private BigDecimal cpl;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    /**
     * Recomputes ctr (percent of impressions), cpm and cpl. Each stays null
     * when its denominator is zero.
     */
    public void recomputeDerived() {
        long impr = impressions == null ? 0 : impressions;
        long leads = conversions == null ? 0 : conversions;
        BigDecimal cost = spend == null ? BigDecimal.ZERO : spend;

        ctr = impr > 0
                ? BigDecimal.valueOf(linkClicks == null ? 0 : linkClicks)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(impr), 4, RoundingMode.HALF_UP)
                : null;
        cpm = impr > 0
                ? cost.multiply(BigDecimal.valueOf(1000)).divide(BigDecimal.valueOf(impr), 4, RoundingMode.HALF_UP)
                : null;
        cpl = leads > 0
                ? cost.divide(BigDecimal.valueOf(leads), 4, RoundingMode.HALF_UP)
                : null;
    }
}
