package com.premiergroup.ad_autopilot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Set;

@Entity
@Table(name = "ad_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"directives", "contactEndpoints"})
@ToString(exclude = {"directives", "contactEndpoints"})
public class AdAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /** Customer id on the ad platform. */
    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    /** Single-endpoint field kept from before per-account endpoint lists existed. */
    @Column(name = "legacy_contact_endpoint")
    private String legacyContactEndpoint;

    @Builder.Default
    @Column(name = "autopilot_enabled", nullable = false)
    private Boolean autopilotEnabled = Boolean.TRUE;

    @Builder.Default
    @Column(name = "dry_run", nullable = false)
    private Boolean dryRun = Boolean.FALSE;

    @Builder.Default
    @Column(name = "date_create", nullable = false)
    private LocalDateTime dateCreate = LocalDateTime.now();

    @OneToMany(mappedBy = "account")
    private Set<Directive> directives;

    @OneToMany(mappedBy = "account")
    private Set<ContactEndpoint> contactEndpoints;
}
