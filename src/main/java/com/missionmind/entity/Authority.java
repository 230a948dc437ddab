package com.missionmind.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "authority")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Authority {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(name = "org_unit_id", nullable = false, length = 64)
    private String orgUnitId;

    @Column(length = 20)
    private String grade;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "authority_scope", joinColumns = @JoinColumn(name = "authority_id"))
    @Column(name = "scope_keyword", length = 100)
    @Builder.Default
    private Set<String> scope = new LinkedHashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
