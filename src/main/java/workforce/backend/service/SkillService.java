package workforce.backend.service;

import workforce.backend.model.Employee;
import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import workforce.backend.repository.EmployeeRepository;
import workforce.backend.repository.PerformanceLogRepository;
import workforce.backend.repository.TaskRepository;
import workforce.backend.scoring.SkillMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rule-based skill analysis over employee profiles and task requirements:
 * who fits a task best, and what an employee is missing for their role.
 */
public class SkillService {

    private static final Logger log = LoggerFactory.getLogger(SkillService.class);

    /** Score assumed for employees without a scored history */
    public static final double DEFAULT_PERFORMANCE_SCORE = 50.0;

    public static final int MAX_RECOMMENDATIONS = 3;

    private final EmployeeRepository employeeRepository;
    private final TaskRepository taskRepository;
    private final PerformanceLogRepository performanceLogRepository;

    public SkillService(EmployeeRepository employeeRepository, TaskRepository taskRepository,
            PerformanceLogRepository performanceLogRepository) {
        this.employeeRepository = employeeRepository;
        this.taskRepository = taskRepository;
        this.performanceLogRepository = performanceLogRepository;
    }

    /**
     * Best three active employees for a task, highest rank first.
     * When the task's assignee has a profile with a department, only that department is considered.
     *
     * @throws NotFoundException if the tenant has no such task
     */
    public List<Recommendation> recommend(String tenantId, String taskId) {
        Task task = taskRepository.findById(tenantId, taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));

        String department = null;
        if (task.hasAssignee()) {
            department = employeeRepository.findById(tenantId, task.assigneeId())
                    .map(Employee::department)
                    .orElse(null);
        }

        Map<String, Map<TaskStatus, Integer>> taskCounts = taskRepository.countByAssigneeAndStatus(tenantId);
        Map<String, Double> scores = performanceLogRepository.findLatestScores(tenantId);
        int requiredCount = SkillMatcher.normalize(task.requiredSkills()).size();

        List<Recommendation> ranked = new ArrayList<>();
        for (Employee employee : employeeRepository.findByTenant(tenantId)) {
            if (!employee.active() || (department != null && !department.equals(employee.department()))) {
                continue;
            }
            int matched = SkillMatcher.overlap(employee.skills(), task.requiredSkills());
            int open = openTasks(taskCounts.getOrDefault(employee.id(), Map.of()));
            double performance = scores.getOrDefault(employee.id(), DEFAULT_PERFORMANCE_SCORE);

            ranked.add(new Recommendation(
                    employee,
                    matched,
                    SkillMatcher.overlapRate(matched, requiredCount),
                    open,
                    performance,
                    SkillMatcher.rank(matched, requiredCount, open, performance)));
        }

        ranked.sort(Comparator.comparingDouble(Recommendation::rank).reversed()
                .thenComparing(r -> r.employee().id()));

        log.debug("Ranked {} candidates for task {} (department {})", ranked.size(), taskId, department);
        return List.copyOf(ranked.subList(0, Math.min(MAX_RECOMMENDATIONS, ranked.size())));
    }

    /**
     * Skills an active employee lacks for the tasks of their role.
     * The role is every active employee with the same job title; without a job
     * title only the employee's own tasks count. Deactivated tasks still describe the role.
     *
     * @throws NotFoundException if the tenant has no active profile for this employee
     */
    public SkillGapReport skillGaps(String tenantId, String employeeId) {
        Employee employee = employeeRepository.findById(tenantId, employeeId)
                .filter(Employee::active)
                .orElseThrow(() -> new NotFoundException("Employee not found: " + employeeId));

        List<String> roleMembers;
        if (employee.jobTitle() != null) {
            roleMembers = employeeRepository.findByTenant(tenantId).stream()
                    .filter(e -> e.active() && Objects.equals(e.jobTitle(), employee.jobTitle()))
                    .map(Employee::id)
                    .toList();
        } else {
            roleMembers = List.of(employee.id());
        }

        List<String> required = new ArrayList<>();
        for (Task task : taskRepository.findByAssignees(tenantId, roleMembers)) {
            required.addAll(task.requiredSkills());
        }

        Set<String> requiredSet = SkillMatcher.normalize(required);
        List<String> gaps = SkillMatcher.gaps(employee.skills(), requiredSet);

        return new SkillGapReport(
                employee.id(),
                employee.displayName(),
                employee.skills(),
                List.copyOf(requiredSet),
                gaps,
                SkillMatcher.coverage(requiredSet.size(), gaps.size()));
    }

    private static int openTasks(Map<TaskStatus, Integer> counts) {
        int open = 0;
        for (Map.Entry<TaskStatus, Integer> entry : counts.entrySet()) {
            if (entry.getKey() != TaskStatus.COMPLETED) {
                open += entry.getValue();
            }
        }
        return open;
    }
}
