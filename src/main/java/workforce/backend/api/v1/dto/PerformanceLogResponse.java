package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.PerformanceLog;

import java.time.Instant;

public record PerformanceLogResponse(
        @JsonProperty("id") String id,
        @JsonProperty("employeeId") String employeeId,
        @JsonProperty("score") Double score,
        @JsonProperty("completionRate") Double completionRate,
        @JsonProperty("onTimeRate") Double onTimeRate,
        @JsonProperty("avgComplexity") Double avgComplexity,
        @JsonProperty("createdAt") Instant createdAt) {

    public static PerformanceLogResponse from(PerformanceLog log) {
        return new PerformanceLogResponse(
                log.id(),
                log.employeeId(),
                log.score(),
                log.completionRate(),
                log.onTimeRate(),
                log.avgComplexity(),
                log.createdAt());
    }
}
