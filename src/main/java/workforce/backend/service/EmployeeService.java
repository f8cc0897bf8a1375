package workforce.backend.service;

import workforce.backend.model.Employee;
import workforce.backend.repository.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Employee skill profiles. Profiles are optional: scoring and the task
 * lifecycle only need the employee id.
 */
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    private final EmployeeRepository employeeRepository;

    public EmployeeService(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    /**
     * Create or replace the profile of an employee.
     */
    public Employee save(String tenantId, String employeeId, EmployeeDraft draft) {
        requireId(tenantId, "tenantId");
        requireId(employeeId, "employeeId");

        Employee employee = new Employee(
                employeeId.trim(),
                tenantId,
                blankToNull(draft.name()),
                blankToNull(draft.jobTitle()),
                blankToNull(draft.department()),
                cleanSkills(draft.skills()),
                draft.active() == null || draft.active(),
                null);

        employeeRepository.save(employee);
        log.info("Saved profile of employee {} ({} skills)", employee.id(), employee.skills().size());
        return get(tenantId, employee.id());
    }

    /**
     * @throws NotFoundException if the tenant has no profile for this employee
     */
    public Employee get(String tenantId, String employeeId) {
        requireId(tenantId, "tenantId");
        requireId(employeeId, "employeeId");
        return employeeRepository.findById(tenantId, employeeId)
                .orElseThrow(() -> new NotFoundException("Employee not found: " + employeeId));
    }

    private static List<String> cleanSkills(List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        return skills.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
