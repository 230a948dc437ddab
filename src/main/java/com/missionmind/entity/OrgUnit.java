package com.missionmind.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "org_unit")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrgUnit {

    /**
     * Section code, e.g. {@code OPS_G3}. Routing keywords resolve to these codes.
     */
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 50)
    private String echelon;

    @Column(name = "parent_id", length = 64)
    private String parentId;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
