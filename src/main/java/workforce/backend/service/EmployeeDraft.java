package workforce.backend.service;

import java.util.List;

/**
 * Fields of an employee profile to store. A null active flag keeps the employee active.
 */
public record EmployeeDraft(
        String name,
        String jobTitle,
        String department,
        List<String> skills,
        Boolean active) {
}
