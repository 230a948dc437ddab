package com.missionmind.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class TaskMetricsService {

    private final AtomicLong tasksCreated = new AtomicLong();
    private final AtomicLong tasksRescored = new AtomicLong();
    private final AtomicLong assignmentsGenerated = new AtomicLong();
    private final AtomicLong manualAssignments = new AtomicLong();
    private final AtomicLong insightRequests = new AtomicLong();

    public void recordTaskCreated(String taskId, double priorityScore) {
        long count = tasksCreated.incrementAndGet();
        log.info("Task {} created with priority {}. Total tasks created={}.", taskId, priorityScore, count);
    }

    public void recordTaskRescored(String taskId, double previousScore, double newScore) {
        long count = tasksRescored.incrementAndGet();
        if (previousScore != newScore) {
            log.info("Task {} priority changed {} -> {}. Total rescores={}.", taskId, previousScore, newScore, count);
        } else {
            log.debug("Task {} priority unchanged at {}. Total rescores={}.", taskId, newScore, count);
        }
    }

    public void recordAssignmentGenerated(String taskId, String assigneeId) {
        long total = assignmentsGenerated.incrementAndGet();
        log.info("Generated owner assignment for task {} -> {}. Total generated={}.", taskId, assigneeId, total);
    }

    public void recordManualAssignment(String taskId, String assigneeId, String role) {
        long total = manualAssignments.incrementAndGet();
        log.info("Task {} assigned to {} as {}. Total manual assignments={}.", taskId, assigneeId, role, total);
    }

    public void recordInsightRequest(String kind, String taskId) {
        long count = insightRequests.incrementAndGet();
        log.debug("Insight '{}' requested for task {}. Total insight requests={}.", kind, taskId, count);
    }

    @PreDestroy
    public void logSummary() {
        log.info("Task stats: created={}, rescored={}, assignmentsGenerated={}, manualAssignments={}, insightRequests={}.",
                tasksCreated.get(), tasksRescored.get(), assignmentsGenerated.get(),
                manualAssignments.get(), insightRequests.get());
    }
}
