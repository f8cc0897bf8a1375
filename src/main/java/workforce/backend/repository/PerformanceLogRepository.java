package workforce.backend.repository;

import workforce.backend.model.PerformanceLog;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only score history. There is no update or delete.
 */
public interface PerformanceLogRepository {

    /**
     * Insert a new row and return it with its generated id and timestamp.
     */
    PerformanceLog append(String tenantId, String employeeId, Double score,
            Double completionRate, Double onTimeRate, Double avgComplexity);

    /**
     * Rows of one employee created at or after {@code since}, newest first.
     */
    List<PerformanceLog> findSince(String tenantId, String employeeId, Instant since);

    /**
     * Latest rows of one employee, newest first.
     */
    List<PerformanceLog> findRecent(String tenantId, String employeeId, int limit);

    /**
     * Most recent non-null score of every scored employee of a tenant.
     */
    Map<String, Double> findLatestScores(String tenantId);

    /**
     * Latest rows with a score across a tenant, newest first.
     */
    List<PerformanceLog> findRecentScored(String tenantId, int limit);
}
