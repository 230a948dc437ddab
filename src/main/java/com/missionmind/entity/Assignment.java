package com.missionmind.entity;

import com.missionmind.engine.model.AssigneeType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Entity
@Table(name = "assignment")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignee_type", nullable = false, length = 20)
    @Builder.Default
    private AssigneeType assigneeType = AssigneeType.ORGANIZATION;

    @Column(name = "assignee_id", nullable = false, length = 64)
    private String assigneeId;

    @Column(nullable = false, length = 32)
    private String role;

    @Column(name = "due_override_date")
    private LocalDate dueOverrideDate;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String state = "pending";

    @Column(columnDefinition = "TEXT")
    private String rationale;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
