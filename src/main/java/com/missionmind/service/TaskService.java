package com.missionmind.service;

import com.missionmind.api.AssignmentRequest;
import com.missionmind.api.CommentRequest;
import com.missionmind.api.TaskCreateRequest;
import com.missionmind.api.TaskUpdateRequest;
import com.missionmind.config.MissionMindProperties;
import com.missionmind.engine.AssignmentGenerator;
import com.missionmind.engine.AuthorityLookup;
import com.missionmind.engine.AuthorityResolver;
import com.missionmind.engine.OrgHierarchyReader;
import com.missionmind.engine.PriorityScorer;
import com.missionmind.engine.RiskAssessor;
import com.missionmind.engine.TaskSummarizer;
import com.missionmind.engine.model.AssigneeType;
import com.missionmind.engine.model.AssignmentRecord;
import com.missionmind.engine.model.AuthoritySuggestion;
import com.missionmind.engine.model.Classification;
import com.missionmind.engine.model.PriorityBreakdown;
import com.missionmind.engine.model.QualityCheckResult;
import com.missionmind.engine.model.RiskInsight;
import com.missionmind.engine.model.TaskSnapshot;
import com.missionmind.engine.model.TaskStatus;
import com.missionmind.engine.model.TaskSummary;
import com.missionmind.engine.quality.QualityChecker;
import com.missionmind.entity.Assignment;
import com.missionmind.entity.Comment;
import com.missionmind.entity.Task;
import com.missionmind.repository.AssignmentRepository;
import com.missionmind.repository.CommentRepository;
import com.missionmind.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Task lifecycle and the read-side insights computed from a stored task.
 * Creation and updates stamp the priority score; creation also routes the task and
 * stores exactly one pending owner assignment with it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;
    private final AssignmentRepository assignmentRepository;
    private final CommentRepository commentRepository;
    private final OrgHierarchyReader hierarchyReader;
    private final AuthorityLookup authorityLookup;
    private final PriorityScorer priorityScorer;
    private final AssignmentGenerator assignmentGenerator;
    private final AuthorityResolver authorityResolver;
    private final RiskAssessor riskAssessor;
    private final QualityChecker qualityChecker;
    private final TaskSummarizer taskSummarizer;
    private final TaskMetricsService metricsService;
    private final MissionMindProperties properties;
    private final Clock clock;

    @Transactional
    public Task create(TaskCreateRequest request) {
        String taskId = StringUtils.hasText(request.id()) ? request.id().trim() : nextTaskId();
        if (taskRepository.existsById(taskId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Task '%s' already exists.".formatted(taskId));
        }

        Task task = Task.builder()
                .id(taskId)
                .title(request.title())
                .description(request.description())
                .classification(request.classification() != null ? request.classification() : Classification.UNCLASSIFIED)
                .suspenseDate(request.suspenseDate())
                .originator(request.originator())
                .orgUnitId(request.orgUnitId().trim())
                .recordSeriesId(request.recordSeriesId())
                .tags(cleanTags(request.tags()))
                .status(TaskStatus.OPEN.value())
                .build();
        task.setPriorityScore(priorityScorer.score(snapshotOf(task), today()));

        AssignmentRecord generated = assignmentGenerator.generate(snapshotOf(task), hierarchyReader);
        task.addAssignment(Assignment.builder()
                .assigneeType(generated.assigneeType())
                .assigneeId(generated.assigneeId())
                .role(generated.role())
                .state(generated.state())
                .rationale(generated.rationale())
                .build());

        Task saved = taskRepository.save(task);
        metricsService.recordTaskCreated(saved.getId(), saved.getPriorityScore());
        metricsService.recordAssignmentGenerated(saved.getId(), generated.assigneeId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Task> list(@Nullable String status, @Nullable LocalDate dueBefore, @Nullable String orgUnitId) {
        Specification<Task> spec = (root, query, cb) -> cb.conjunction();
        if (StringUtils.hasText(status)) {
            spec = spec.and(TaskRepository.hasStatus(normalizeStatus(status)));
        }
        if (dueBefore != null) {
            spec = spec.and(TaskRepository.dueOnOrBefore(dueBefore));
        }
        if (StringUtils.hasText(orgUnitId)) {
            spec = spec.and(TaskRepository.inOrgUnit(orgUnitId));
        }
        return taskRepository.findAll(spec, Sort.by("suspenseDate", "id"));
    }

    @Transactional(readOnly = true)
    public Task get(String taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found."));
    }

    @Transactional
    public Task update(String taskId, TaskUpdateRequest request) {
        Task task = get(taskId);
        if (request.title() != null) {
            task.setTitle(request.title());
        }
        if (request.description() != null) {
            task.setDescription(request.description());
        }
        if (request.classification() != null) {
            task.setClassification(request.classification());
        }
        if (request.suspenseDate() != null) {
            task.setSuspenseDate(request.suspenseDate());
        }
        if (request.originator() != null) {
            task.setOriginator(request.originator());
        }
        if (StringUtils.hasText(request.orgUnitId())) {
            task.setOrgUnitId(request.orgUnitId().trim());
        }
        if (request.recordSeriesId() != null) {
            task.setRecordSeriesId(StringUtils.hasText(request.recordSeriesId()) ? request.recordSeriesId() : null);
        }
        if (StringUtils.hasText(request.status())) {
            task.setStatus(normalizeStatus(request.status()));
        }
        if (request.tags() != null) {
            task.getTags().clear();
            task.getTags().addAll(cleanTags(request.tags()));
        }

        double previous = task.getPriorityScore();
        task.setPriorityScore(priorityScorer.score(snapshotOf(task), today()));
        Task saved = taskRepository.save(task);
        metricsService.recordTaskRescored(saved.getId(), previous, saved.getPriorityScore());
        return saved;
    }

    @Transactional
    public Assignment addAssignment(String taskId, AssignmentRequest request) {
        Task task = get(taskId);
        Assignment assignment = Assignment.builder()
                .task(task)
                .assigneeType(request.assigneeType() != null ? request.assigneeType() : AssigneeType.ORGANIZATION)
                .assigneeId(request.assigneeId())
                .role(request.role())
                .dueOverrideDate(request.dueOverrideDate())
                .state(StringUtils.hasText(request.state()) ? request.state() : AssignmentGenerator.PENDING_STATE)
                .rationale(request.rationale())
                .build();
        Assignment saved = assignmentRepository.save(assignment);
        metricsService.recordManualAssignment(taskId, saved.getAssigneeId(), saved.getRole());
        return saved;
    }

    @Transactional
    public Comment addComment(String taskId, CommentRequest request) {
        Task task = get(taskId);
        Comment comment = Comment.builder()
                .task(task)
                .authorUserId(request.authorUserId())
                .body(request.body())
                .parentCommentId(request.parentCommentId())
                .build();
        return commentRepository.save(comment);
    }

    @Transactional(readOnly = true)
    public List<Comment> listComments(String taskId) {
        get(taskId);
        return commentRepository.findByTask_IdOrderByCreatedAtAscIdAsc(taskId);
    }

    @Transactional(readOnly = true)
    public TaskSummary summary(String taskId) {
        Task task = get(taskId);
        List<String> comments = commentRepository.findByTask_IdOrderByCreatedAtAscIdAsc(taskId).stream()
                .map(Comment::getBody)
                .toList();
        metricsService.recordInsightRequest("summary", taskId);
        return taskSummarizer.summarize(snapshotOf(task), comments);
    }

    @Transactional(readOnly = true)
    public List<AuthoritySuggestion> authoritySuggestions(String taskId, @Nullable Integer limit) {
        if (limit != null && limit < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be at least 1.");
        }
        Task task = get(taskId);
        metricsService.recordInsightRequest("authority-suggestions", taskId);
        TaskSnapshot snapshot = snapshotOf(task);
        return limit == null
                ? authorityResolver.suggest(snapshot, hierarchyReader, authorityLookup)
                : authorityResolver.suggest(snapshot, hierarchyReader, authorityLookup, limit);
    }

    @Transactional(readOnly = true)
    public RiskInsight risk(String taskId) {
        Task task = get(taskId);
        metricsService.recordInsightRequest("risk", taskId);
        return riskAssessor.assess(snapshotOf(task));
    }

    @Transactional(readOnly = true)
    public QualityCheckResult qualityCheck(String taskId) {
        Task task = get(taskId);
        metricsService.recordInsightRequest("quality-check", taskId);
        return qualityChecker.check(snapshotOf(task));
    }

    @Transactional(readOnly = true)
    public PriorityBreakdown priority(String taskId) {
        Task task = get(taskId);
        metricsService.recordInsightRequest("priority", taskId);
        return priorityScorer.explain(snapshotOf(task), today());
    }

    static TaskSnapshot snapshotOf(Task task) {
        return TaskSnapshot.builder()
                .taskId(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .tags(List.copyOf(task.getTags()))
                .classification(task.getClassification())
                .suspenseDate(task.getSuspenseDate())
                .originator(task.getOriginator())
                .orgUnitId(task.getOrgUnitId())
                .status(task.getStatus())
                .recordSeriesId(task.getRecordSeriesId())
                .priorityScore(task.getPriorityScore())
                .build();
    }

    private String nextTaskId() {
        int year = today().getYear() % 100;
        long sequence = taskRepository.count() + 1;
        String candidate = formatTaskId(year, sequence);
        while (taskRepository.existsById(candidate)) {
            sequence++;
            candidate = formatTaskId(year, sequence);
        }
        return candidate;
    }

    private String formatTaskId(int year, long sequence) {
        return "%s-%02d-%06d".formatted(properties.getTaskIdPrefix(), year, sequence);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Known statuses are stored in canonical form ("in-work" becomes "in_work"); anything
     * else is kept as given, lower-cased.
     */
    private static String normalizeStatus(String status) {
        return TaskStatus.fromValue(status)
                .map(TaskStatus::value)
                .orElse(status.trim().toLowerCase(Locale.ROOT));
    }

    private static List<String> cleanTags(@Nullable List<String> tags) {
        List<String> cleaned = new ArrayList<>();
        if (tags == null) {
            return cleaned;
        }
        for (String tag : tags) {
            if (StringUtils.hasText(tag)) {
                cleaned.add(tag.trim());
            }
        }
        return cleaned;
    }
}
