package workforce.backend.scoring;

import workforce.backend.model.Task;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Deterministic productivity scorer.
 *
 * Weights:
 * - 40% completion rate (completed / assigned)
 * - 35% on-time rate (on time / completed with a due date)
 * - 25% average complexity (mean / 5)
 *
 * No I/O, no state: the same task snapshot always yields the same result.
 */
public final class ScoringEngine {

    private static final BigDecimal COMPLETION_WEIGHT = BigDecimal.valueOf(40);
    private static final BigDecimal ON_TIME_WEIGHT = BigDecimal.valueOf(35);
    private static final BigDecimal COMPLEXITY_WEIGHT = BigDecimal.valueOf(25);
    private static final BigDecimal MAX_COMPLEXITY = BigDecimal.valueOf(5);

    private ScoringEngine() {
    }

    /**
     * Score all tasks assigned to one employee (any status).
     */
    public static ScoreResult score(Collection<Task> tasks) {
        int totalAssigned = tasks.size();
        if (totalAssigned == 0) {
            return ScoreResult.absent();
        }

        int totalCompleted = 0;
        int completedWithDueDate = 0;
        int totalOnTime = 0;
        long complexitySum = 0;

        for (Task task : tasks) {
            complexitySum += task.complexity();
            if (!task.isCompleted()) {
                continue;
            }
            totalCompleted++;
            if (task.dueDate() != null) {
                completedWithDueDate++;
                if (task.completedOnTime()) {
                    totalOnTime++;
                }
            }
        }

        double completionRate = (double) totalCompleted / totalAssigned;
        Double onTimeRate = completedWithDueDate > 0 ? (double) totalOnTime / completedWithDueDate : null;
        double avgComplexity = (double) complexitySum / totalAssigned;

        double score = computeScore(completionRate, onTimeRate, avgComplexity);

        ScoreBreakdown breakdown = new ScoreBreakdown(
                round(completionRate, 3),
                onTimeRate != null ? round(onTimeRate, 3) : null,
                round(avgComplexity, 2),
                totalAssigned,
                totalCompleted,
                totalOnTime);

        return new ScoreResult(score, grade(score), breakdown);
    }

    /**
     * Weighted score rounded half-up to one decimal. An absent on-time rate
     * contributes nothing to the sum.
     */
    public static double computeScore(double completionRate, Double onTimeRate, double avgComplexity) {
        BigDecimal raw = BigDecimal.valueOf(completionRate).multiply(COMPLETION_WEIGHT)
                .add(onTimeRate != null ? BigDecimal.valueOf(onTimeRate).multiply(ON_TIME_WEIGHT) : BigDecimal.ZERO)
                .add(BigDecimal.valueOf(avgComplexity)
                        .divide(MAX_COMPLEXITY, MathContext.DECIMAL64)
                        .multiply(COMPLEXITY_WEIGHT));
        return raw.setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * A+ >= 90, A >= 80, B >= 70, C >= 60, D below.
     */
    public static String grade(double score) {
        if (score >= 90)
            return "A+";
        if (score >= 80)
            return "A";
        if (score >= 70)
            return "B";
        if (score >= 60)
            return "C";
        return "D";
    }

    private static double round(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }
}
