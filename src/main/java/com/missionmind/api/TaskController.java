package com.missionmind.api;

import com.missionmind.engine.model.AuthoritySuggestion;
import com.missionmind.engine.model.PriorityBreakdown;
import com.missionmind.engine.model.QualityCheckResult;
import com.missionmind.engine.model.RiskInsight;
import com.missionmind.engine.model.TaskSummary;
import com.missionmind.service.TaskService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse create(@Valid @RequestBody TaskCreateRequest request) {
        return TaskResponse.from(taskService.create(request));
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(value = "status", required = false) String status,
                                   @RequestParam(value = "dueBefore", required = false)
                                   @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueBefore,
                                   @RequestParam(value = "org", required = false) String org) {
        return taskService.list(status, dueBefore, org).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @GetMapping("/{taskId}")
    public TaskResponse get(@PathVariable String taskId) {
        return TaskResponse.from(taskService.get(taskId));
    }

    @PatchMapping("/{taskId}")
    public TaskResponse update(@PathVariable String taskId, @RequestBody TaskUpdateRequest request) {
        return TaskResponse.from(taskService.update(taskId, request));
    }

    @PostMapping("/{taskId}/assignments")
    @ResponseStatus(HttpStatus.CREATED)
    public AssignmentResponse addAssignment(@PathVariable String taskId,
                                            @Valid @RequestBody AssignmentRequest request) {
        return AssignmentResponse.from(taskService.addAssignment(taskId, request));
    }

    @PostMapping("/{taskId}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    public CommentResponse addComment(@PathVariable String taskId, @Valid @RequestBody CommentRequest request) {
        return CommentResponse.from(taskService.addComment(taskId, request));
    }

    @GetMapping("/{taskId}/comments")
    public List<CommentResponse> listComments(@PathVariable String taskId) {
        return taskService.listComments(taskId).stream()
                .map(CommentResponse::from)
                .toList();
    }

    @GetMapping("/{taskId}/summary")
    public TaskSummary summary(@PathVariable String taskId) {
        return taskService.summary(taskId);
    }

    @GetMapping("/{taskId}/authority-suggestions")
    public List<AuthoritySuggestion> authoritySuggestions(@PathVariable String taskId,
                                                          @RequestParam(value = "limit", required = false) Integer limit) {
        return taskService.authoritySuggestions(taskId, limit);
    }

    @GetMapping("/{taskId}/risk")
    public RiskInsight risk(@PathVariable String taskId) {
        return taskService.risk(taskId);
    }

    @GetMapping("/{taskId}/quality-check")
    public QualityCheckResult qualityCheck(@PathVariable String taskId) {
        return taskService.qualityCheck(taskId);
    }

    @GetMapping("/{taskId}/priority")
    public PriorityBreakdown priority(@PathVariable String taskId) {
        return taskService.priority(taskId);
    }
}
