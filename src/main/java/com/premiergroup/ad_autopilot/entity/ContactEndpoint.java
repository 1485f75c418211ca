package com.premiergroup.ad_autopilot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "contact_endpoints",
        uniqueConstraints = @UniqueConstraint(columnNames = {"account_id", "endpoint_value"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "account")
@ToString(exclude = "account")
public class ContactEndpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", nullable = false)
    private AdAccount account;

    @Column(name = "endpoint_value", nullable = false)
    private String value;

    private String label;

    @Builder.Default
    @Column(name = "is_default", nullable = false)
    private Boolean isDefault = Boolean.FALSE;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = Boolean.TRUE;
}
