package workforce.backend.service;

import workforce.backend.model.LedgerEntry;
import workforce.backend.model.PerformanceLog;

import java.time.Instant;
import java.util.List;

/**
 * Tenant-wide summary of employees, task completion, scores and ledger activity.
 *
 * @param averageScore mean of the latest scores of scored employees, null when nobody was scored
 */
public record DashboardStats(
        int totalEmployees,
        int activeEmployees,
        int tasksAssigned,
        int tasksCompleted,
        double completionRate,
        Double averageScore,
        Performer topPerformer,
        Performer lowestPerformer,
        List<EmployeeStats> employees,
        List<PerformanceLog> recentPerformanceLogs,
        List<LedgerEntry> recentLedgerEntries,
        Instant generatedAt) {

    public record Performer(String employeeId, String name, double score) {
    }

    /**
     * @param productivityScore latest score, null when never scored
     * @param verifiedTasks     tasks of this employee recorded on the ledger
     */
    public record EmployeeStats(
            String employeeId,
            String name,
            String jobTitle,
            String department,
            boolean active,
            int tasksAssigned,
            int tasksCompleted,
            double completionRate,
            Double productivityScore,
            int verifiedTasks) {
    }
}
