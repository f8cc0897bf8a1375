package workforce.backend.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Skill profile of an employee. Tasks refer to employees by id only, so an
 * assignee may exist without a profile.
 */
public record Employee(
        String id,
        String tenantId,
        String name,
        String jobTitle,
        String department,
        List<String> skills,
        boolean active,
        Instant createdAt) {

    public Employee {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(tenantId, "tenantId is required");
        skills = skills != null ? List.copyOf(skills) : List.of();
    }

    /** Name for display, the id when the profile has none */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
