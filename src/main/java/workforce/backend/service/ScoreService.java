package workforce.backend.service;

import workforce.backend.model.PerformanceLog;
import workforce.backend.model.Task;
import workforce.backend.narrative.NarrativeClient;
import workforce.backend.narrative.NarrativeRequest;
import workforce.backend.narrative.NarrativeUnavailableException;
import workforce.backend.narrative.TemplateNarrative;
import workforce.backend.repository.PerformanceLogRepository;
import workforce.backend.repository.TaskRepository;
import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.ScoringEngine;
import workforce.backend.scoring.TrendAnalysis;
import workforce.backend.scoring.TrendCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Employee scoring: the background recompute that appends history,
 * and the read path that never writes.
 */
public class ScoreService {

    private static final Logger log = LoggerFactory.getLogger(ScoreService.class);

    public static final int MAX_HISTORY_LIMIT = 200;

    private final TaskRepository taskRepository;
    private final PerformanceLogRepository performanceLogRepository;
    private final NarrativeClient narrativeClient;
    private final Clock clock;

    public ScoreService(TaskRepository taskRepository, PerformanceLogRepository performanceLogRepository,
            NarrativeClient narrativeClient, Clock clock) {
        this.taskRepository = taskRepository;
        this.performanceLogRepository = performanceLogRepository;
        this.narrativeClient = narrativeClient;
        this.clock = clock;
    }

    /**
     * Compute the current score of an employee and append it to the history.
     * An employee without tasks gets a row with null values.
     */
    public PerformanceLog recordScore(String tenantId, String employeeId) {
        ScoreResult result = ScoringEngine.score(taskRepository.findActiveByAssignee(tenantId, employeeId));

        ScoreBreakdown b = result.breakdown();
        PerformanceLog row = performanceLogRepository.append(
                tenantId,
                employeeId,
                result.score(),
                b != null ? b.completionRate() : null,
                b != null ? b.onTimeRate() : null,
                b != null ? b.avgComplexity() : null);

        log.info("Recorded score {} ({}) for employee {}", result.score(), result.grade(), employeeId);
        return row;
    }

    /**
     * Current score, trend and explanation. Reads only.
     */
    public EmployeeScore score(String tenantId, String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("employeeId is required");
        }

        Instant now = clock.instant();
        List<Task> tasks = taskRepository.findActiveByAssignee(tenantId, employeeId);
        ScoreResult result = ScoringEngine.score(tasks);

        List<PerformanceLog> history = performanceLogRepository.findSince(
                tenantId, employeeId, TrendCalculator.horizon(now));
        TrendAnalysis trend = TrendCalculator.analyze(history, now);

        NarrativeRequest request = new NarrativeRequest(employeeId, result, trend);
        if (!result.isAbsent() && narrativeClient.isEnabled()) {
            try {
                String narrative = narrativeClient.explain(request);
                return new EmployeeScore(employeeId, result, trend, narrative, EmployeeScore.SOURCE_MODEL);
            } catch (NarrativeUnavailableException e) {
                log.warn("Narrative model unavailable for employee {}, using template: {}",
                        employeeId, e.getMessage());
            }
        }

        return new EmployeeScore(employeeId, result, trend, TemplateNarrative.explain(request),
                EmployeeScore.SOURCE_TEMPLATE);
    }

    /**
     * Score history, newest first.
     */
    public List<PerformanceLog> history(String tenantId, String employeeId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return performanceLogRepository.findRecent(tenantId, employeeId, Math.min(limit, MAX_HISTORY_LIMIT));
    }
}
