package workforce.backend.service;

import workforce.backend.model.Employee;
import workforce.backend.model.TaskStatus;
import workforce.backend.repository.EmployeeRepository;
import workforce.backend.repository.LedgerEntryRepository;
import workforce.backend.repository.PerformanceLogRepository;
import workforce.backend.repository.TaskRepository;
import workforce.backend.service.DashboardStats.EmployeeStats;
import workforce.backend.service.DashboardStats.Performer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregates for the tenant dashboard.
 * Counts cover active tasks with an assignee. Employees listed are every
 * profile plus every assignee without one.
 */
public class DashboardService {

    public static final int RECENT_LIMIT = 10;

    private final EmployeeRepository employeeRepository;
    private final TaskRepository taskRepository;
    private final PerformanceLogRepository performanceLogRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    public DashboardService(EmployeeRepository employeeRepository, TaskRepository taskRepository,
            PerformanceLogRepository performanceLogRepository, LedgerEntryRepository ledgerEntryRepository,
            Clock clock) {
        this.employeeRepository = employeeRepository;
        this.taskRepository = taskRepository;
        this.performanceLogRepository = performanceLogRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.clock = clock;
    }

    public DashboardStats stats(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }

        List<Employee> profiles = employeeRepository.findByTenant(tenantId);
        Map<String, Map<TaskStatus, Integer>> taskCounts = taskRepository.countByAssigneeAndStatus(tenantId);
        Map<String, Double> scores = performanceLogRepository.findLatestScores(tenantId);
        Map<String, Integer> verified = ledgerEntryRepository.countByAssignee(tenantId);

        Map<String, Employee> byId = new LinkedHashMap<>();
        for (Employee employee : profiles) {
            byId.put(employee.id(), employee);
        }
        for (String assigneeId : taskCounts.keySet()) {
            byId.putIfAbsent(assigneeId, new Employee(assigneeId, tenantId, null, null, null, null, true, null));
        }

        int tasksAssigned = 0;
        int tasksCompleted = 0;
        List<EmployeeStats> employees = new ArrayList<>();
        for (Employee employee : byId.values()) {
            Map<TaskStatus, Integer> counts = taskCounts.getOrDefault(employee.id(), Map.of());
            int assigned = counts.values().stream().mapToInt(Integer::intValue).sum();
            int completed = counts.getOrDefault(TaskStatus.COMPLETED, 0);
            tasksAssigned += assigned;
            tasksCompleted += completed;

            employees.add(new EmployeeStats(
                    employee.id(),
                    employee.displayName(),
                    employee.jobTitle(),
                    employee.department(),
                    employee.active(),
                    assigned,
                    completed,
                    rate(completed, assigned),
                    scores.get(employee.id()),
                    verified.getOrDefault(employee.id(), 0)));
        }
        employees.sort(Comparator.comparingDouble(EmployeeStats::completionRate).reversed()
                .thenComparing(EmployeeStats::name));

        Double averageScore = null;
        Performer top = null;
        Performer lowest = null;
        if (!scores.isEmpty()) {
            double sum = scores.values().stream().mapToDouble(Double::doubleValue).sum();
            averageScore = round1(sum / scores.size());

            List<Map.Entry<String, Double>> sorted = new ArrayList<>(scores.entrySet());
            sorted.sort(Map.Entry.<String, Double>comparingByValue().reversed()
                    .thenComparing(Map.Entry.<String, Double>comparingByKey()));
            top = performer(sorted.get(0), byId);
            lowest = performer(sorted.get(sorted.size() - 1), byId);
        }

        return new DashboardStats(
                profiles.size(),
                (int) profiles.stream().filter(Employee::active).count(),
                tasksAssigned,
                tasksCompleted,
                rate(tasksCompleted, tasksAssigned),
                averageScore,
                top,
                lowest,
                List.copyOf(employees),
                performanceLogRepository.findRecentScored(tenantId, RECENT_LIMIT),
                ledgerEntryRepository.findByTenant(tenantId, RECENT_LIMIT),
                clock.instant());
    }

    private static Performer performer(Map.Entry<String, Double> entry, Map<String, Employee> byId) {
        Employee employee = byId.get(entry.getKey());
        String name = employee != null ? employee.displayName() : entry.getKey();
        return new Performer(entry.getKey(), name, round1(entry.getValue()));
    }

    /** Ratio rounded to three decimals, 0 when nothing was assigned */
    private static double rate(int part, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round((double) part / total * 1000) / 1000.0;
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
