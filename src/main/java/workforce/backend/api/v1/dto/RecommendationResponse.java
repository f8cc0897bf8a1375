package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.service.Recommendation;

/**
 * One candidate of GET /api/v1/tasks/{id}/recommendations. Rank is rounded to one decimal.
 */
public record RecommendationResponse(
        @JsonProperty("employee") EmployeeResponse employee,
        @JsonProperty("matchedSkills") int matchedSkills,
        @JsonProperty("matchRate") double matchRate,
        @JsonProperty("openTasks") int openTasks,
        @JsonProperty("performanceScore") double performanceScore,
        @JsonProperty("rank") double rank) {

    public static RecommendationResponse from(Recommendation r) {
        return new RecommendationResponse(
                EmployeeResponse.from(r.employee()),
                r.matchedSkills(),
                r.matchRate(),
                r.openTasks(),
                r.performanceScore(),
                Math.round(r.rank() * 10) / 10.0);
    }
}
