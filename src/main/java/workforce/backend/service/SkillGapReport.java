package workforce.backend.service;

import java.util.List;

/**
 * Skills an employee lacks for the work of their role.
 *
 * @param requiredSkills union of the skills required by tasks of the role, normalized
 * @param gapSkills      required skills the employee does not have
 * @param coverageRate   (required - gaps) / required, 1.0 when nothing is required
 */
public record SkillGapReport(
        String employeeId,
        String name,
        List<String> currentSkills,
        List<String> requiredSkills,
        List<String> gapSkills,
        double coverageRate) {
}
