package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.Trend;
import workforce.backend.service.EmployeeScore;

/**
 * Response DTO for an employee score.
 * GET /api/v1/employees/{id}/score
 *
 * score, grade and breakdown are null when the employee has no tasks.
 */
public record ScoreResponse(
        @JsonProperty("employeeId") String employeeId,
        @JsonProperty("score") Double score,
        @JsonProperty("grade") String grade,
        @JsonProperty("breakdown") ScoreBreakdown breakdown,
        @JsonProperty("trend") Trend trend,
        @JsonProperty("trendDelta") Double trendDelta,
        @JsonProperty("narrative") String narrative,
        @JsonProperty("narrativeSource") String narrativeSource) {

    public static ScoreResponse from(EmployeeScore s) {
        return new ScoreResponse(
                s.employeeId(),
                s.score().score(),
                s.score().grade(),
                s.score().breakdown(),
                s.trend().trend(),
                s.trend().delta(),
                s.narrative(),
                s.narrativeSource());
    }
}
