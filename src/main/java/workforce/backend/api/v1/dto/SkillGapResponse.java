package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.service.SkillGapReport;

import java.util.List;

/**
 * GET /api/v1/employees/{id}/skill-gaps
 */
public record SkillGapResponse(
        @JsonProperty("employeeId") String employeeId,
        @JsonProperty("name") String name,
        @JsonProperty("currentSkills") List<String> currentSkills,
        @JsonProperty("requiredSkills") List<String> requiredSkills,
        @JsonProperty("gapSkills") List<String> gapSkills,
        @JsonProperty("coverageRate") double coverageRate) {

    public static SkillGapResponse from(SkillGapReport r) {
        return new SkillGapResponse(r.employeeId(), r.name(), r.currentSkills(), r.requiredSkills(),
                r.gapSkills(), r.coverageRate());
    }
}
