package workforce.backend.narrative;

import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.TrendAnalysis;

import java.util.Locale;

/**
 * Deterministic explanation built from the score breakdown.
 * Used whenever the narrative model is unavailable.
 */
public final class TemplateNarrative {

    private TemplateNarrative() {
    }

    public static String explain(NarrativeRequest request) {
        ScoreResult score = request.score();
        if (score == null || score.isAbsent()) {
            return "No tasks are assigned yet, so there is no score to explain.";
        }

        ScoreBreakdown b = score.breakdown();
        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "Score %.1f (grade %s). ", score.score(), score.grade()));
        text.append(String.format(Locale.ROOT, "Completed %d of %d assigned tasks (%s). ",
                b.totalCompleted(), b.totalAssigned(), percent(b.completionRate())));

        if (b.onTimeRate() != null) {
            text.append(String.format(Locale.ROOT, "%s of completed tasks with a deadline were on time. ",
                    percent(b.onTimeRate())));
        } else {
            text.append("No completed task had a deadline, so punctuality did not add to the score. ");
        }

        text.append(String.format(Locale.ROOT, "Average complexity is %.1f of 5.", b.avgComplexity()));

        String trend = describeTrend(request.trend());
        if (trend != null) {
            text.append(' ').append(trend);
        }
        return text.toString();
    }

    private static String describeTrend(TrendAnalysis trend) {
        if (trend == null) {
            return null;
        }
        return switch (trend.trend()) {
            case IMPROVING -> String.format(Locale.ROOT,
                    "Scores are improving: the 30-day average rose by %.1f points.", trend.delta());
            case DECLINING -> String.format(Locale.ROOT,
                    "Scores are declining: the 30-day average fell by %.1f points.", Math.abs(trend.delta()));
            case STABLE -> "Scores are stable compared with the previous 30 days.";
            case INSUFFICIENT_DATA -> "There is not enough history yet to show a trend.";
        };
    }

    private static String percent(double rate) {
        return Math.round(rate * 100) + "%";
    }
}
