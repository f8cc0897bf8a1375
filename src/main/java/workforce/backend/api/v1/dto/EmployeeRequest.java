package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.service.EmployeeDraft;

import java.util.List;

/**
 * Request DTO for storing an employee profile.
 * PUT /api/v1/employees/{id}
 */
public record EmployeeRequest(
        @JsonProperty("name") String name,
        @JsonProperty("jobTitle") String jobTitle,
        @JsonProperty("department") String department,
        @JsonProperty("skills") List<String> skills,
        @JsonProperty("active") Boolean active) {

    public EmployeeDraft toDraft() {
        return new EmployeeDraft(name, jobTitle, department, skills, active);
    }
}
