package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.Employee;

import java.time.Instant;
import java.util.List;

public record EmployeeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("jobTitle") String jobTitle,
        @JsonProperty("department") String department,
        @JsonProperty("skills") List<String> skills,
        @JsonProperty("active") boolean active,
        @JsonProperty("createdAt") Instant createdAt) {

    public static EmployeeResponse from(Employee e) {
        return new EmployeeResponse(e.id(), e.name(), e.jobTitle(), e.department(), e.skills(), e.active(),
                e.createdAt());
    }
}
