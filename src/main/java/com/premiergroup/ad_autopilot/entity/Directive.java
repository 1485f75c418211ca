package com.premiergroup.ad_autopilot.entity;

import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "directives")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"account", "placements"})
@ToString(exclude = {"account", "placements"})
public class Directive {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", nullable = false)
    private AdAccount account;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ObjectiveType objective;

    @Column(name = "daily_budget")
    private BigDecimal dailyBudget;

    @Column(name = "target_cost_per_lead")
    private BigDecimal targetCostPerLead;

    /** Operator-curated endpoint, the most specific tier of endpoint resolution. */
    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "contact_endpoint_id")
    private ContactEndpoint contactEndpoint;

    @Column(name = "external_campaign_id")
    private String externalCampaignId;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = Boolean.TRUE;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "directive_creatives", joinColumns = @JoinColumn(name = "directive_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "creative_ref", nullable = false)
    private List<String> creativeRefs = new ArrayList<>();

    @Builder.Default
    @Column(name = "date_create", nullable = false)
    private LocalDateTime dateCreate = LocalDateTime.now();

    @OneToMany(mappedBy = "directive")
    private Set<Placement> placements;

    /**
     * Endpoint resolution is keyed on the objective, so it is fixed once the
     * external campaign exists.
     */
    public void setObjective(ObjectiveType objective) {
        if (externalCampaignId != null && this.objective != null && this.objective != objective) {
            throw new IllegalStateException(
                    "Objective of directive " + id + " cannot change after its campaign was created");
        }
        this.objective = objective;
    }
}
