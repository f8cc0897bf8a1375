package workforce.backend.model;

import java.time.Instant;

/**
 * One row of the append-only score history of an employee.
 * Score and factors are null when the employee had no tasks at scoring time.
 */
public record PerformanceLog(
        String id,
        String tenantId,
        String employeeId,
        Double score,
        Double completionRate,
        Double onTimeRate,
        Double avgComplexity,
        Instant createdAt) {
}
