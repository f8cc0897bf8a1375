package workforce.backend.scoring;

/**
 * Factor values behind a score.
 *
 * @param completionRate completed / assigned, 0..1
 * @param onTimeRate     on-time / completed-with-due-date, null when no completed task has a due date
 * @param avgComplexity  mean complexity of all assigned tasks, 1..5
 */
public record ScoreBreakdown(
        double completionRate,
        Double onTimeRate,
        double avgComplexity,
        int totalAssigned,
        int totalCompleted,
        int totalOnTime) {
}
