package workforce.backend.narrative;

import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.TrendAnalysis;

import java.util.Locale;

/**
 * Builds the model prompt. Same inputs always give the same text.
 */
final class NarrativePrompt {

    private NarrativePrompt() {
    }

    static String build(NarrativeRequest request) {
        ScoreResult score = request.score();
        ScoreBreakdown b = score.breakdown();
        TrendAnalysis trend = request.trend();

        StringBuilder p = new StringBuilder();
        p.append("You are a workforce analytics assistant. Explain an employee's productivity score ")
                .append("to their manager in two or three plain sentences. Do not invent numbers.\n\n");
        p.append("Employee: ").append(request.employeeId()).append('\n');
        p.append(String.format(Locale.ROOT, "Score: %.1f / 100 (grade %s)%n", score.score(), score.grade()));
        p.append("Weights: completion 40%, on-time 35%, complexity 25%\n");
        p.append(String.format(Locale.ROOT, "Completion rate: %.3f (%d of %d tasks)%n",
                b.completionRate(), b.totalCompleted(), b.totalAssigned()));
        p.append("On-time rate: ")
                .append(b.onTimeRate() != null ? String.format(Locale.ROOT, "%.3f", b.onTimeRate()) : "n/a")
                .append('\n');
        p.append(String.format(Locale.ROOT, "Average complexity: %.2f / 5%n", b.avgComplexity()));
        if (trend != null) {
            p.append("Trend: ").append(trend.trend().wireName());
            if (trend.delta() != null) {
                p.append(String.format(Locale.ROOT, " (delta %.1f)", trend.delta()));
            }
            p.append('\n');
        }
        p.append("\nRespond with JSON only, exactly this shape: {\"summary\": \"<explanation>\"}");
        return p.toString();
    }
}
