package com.missionmind.entity;

import com.missionmind.engine.model.Classification;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "task")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    @Id
    @Column(length = 32)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Classification classification = Classification.UNCLASSIFIED;

    @Column(name = "suspense_date", nullable = false)
    private LocalDate suspenseDate;

    @Column(nullable = false)
    private String originator;

    @Column(name = "org_unit_id", nullable = false, length = 64)
    private String orgUnitId;

    @Column(name = "priority_score", nullable = false)
    @Builder.Default
    private double priorityScore = 0.0;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String status = "draft";

    @Column(name = "record_series_id", length = 64)
    private String recordSeriesId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_tag", joinColumns = @JoinColumn(name = "task_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", length = 100)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @OneToMany(mappedBy = "task", fetch = FetchType.EAGER, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<Assignment> assignments = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public void addAssignment(Assignment assignment) {
        assignment.setTask(this);
        assignments.add(assignment);
    }
}
