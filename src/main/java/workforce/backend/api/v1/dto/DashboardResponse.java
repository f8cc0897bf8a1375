package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.service.DashboardStats;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/dashboard
 */
public record DashboardResponse(
        @JsonProperty("totalEmployees") int totalEmployees,
        @JsonProperty("activeEmployees") int activeEmployees,
        @JsonProperty("tasksAssigned") int tasksAssigned,
        @JsonProperty("tasksCompleted") int tasksCompleted,
        @JsonProperty("completionRate") double completionRate,
        @JsonProperty("averageScore") Double averageScore,
        @JsonProperty("topPerformer") DashboardStats.Performer topPerformer,
        @JsonProperty("lowestPerformer") DashboardStats.Performer lowestPerformer,
        @JsonProperty("employees") List<DashboardStats.EmployeeStats> employees,
        @JsonProperty("recentPerformanceLogs") List<PerformanceLogResponse> recentPerformanceLogs,
        @JsonProperty("recentLedgerEntries") List<LedgerEntryResponse> recentLedgerEntries,
        @JsonProperty("generatedAt") Instant generatedAt) {

    public static DashboardResponse from(DashboardStats s) {
        return new DashboardResponse(
                s.totalEmployees(),
                s.activeEmployees(),
                s.tasksAssigned(),
                s.tasksCompleted(),
                s.completionRate(),
                s.averageScore(),
                s.topPerformer(),
                s.lowestPerformer(),
                s.employees(),
                s.recentPerformanceLogs().stream().map(PerformanceLogResponse::from).toList(),
                s.recentLedgerEntries().stream().map(LedgerEntryResponse::from).toList(),
                s.generatedAt());
    }
}
