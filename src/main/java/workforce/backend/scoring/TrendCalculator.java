package workforce.backend.scoring;

import workforce.backend.model.PerformanceLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Compares the mean score of the last 30 days with the 30 days before.
 *
 * recent   = [now - 30d, now]
 * previous = [now - 60d, now - 30d)
 *
 * delta >= +1 is improving, delta <= -1 declining, anything in between stable.
 */
public final class TrendCalculator {

    public static final Duration WINDOW = Duration.ofDays(30);

    private static final double THRESHOLD = 1.0;
    private static final double EPSILON = 1e-9;

    private TrendCalculator() {
    }

    /**
     * Oldest log timestamp that can influence the trend at {@code now}.
     */
    public static Instant horizon(Instant now) {
        return now.minus(WINDOW.multipliedBy(2));
    }

    public static TrendAnalysis analyze(Collection<PerformanceLog> logs, Instant now) {
        Instant recentStart = now.minus(WINDOW);
        Instant previousStart = horizon(now);

        double recentSum = 0;
        int recentCount = 0;
        double previousSum = 0;
        int previousCount = 0;

        for (PerformanceLog log : logs) {
            if (log.score() == null || log.createdAt() == null || log.createdAt().isAfter(now)) {
                continue;
            }
            Instant at = log.createdAt();
            if (!at.isBefore(recentStart)) {
                recentSum += log.score();
                recentCount++;
            } else if (!at.isBefore(previousStart)) {
                previousSum += log.score();
                previousCount++;
            }
        }

        if (recentCount == 0 || previousCount == 0) {
            return TrendAnalysis.insufficient();
        }

        double recentAvg = recentSum / recentCount;
        double previousAvg = previousSum / previousCount;
        double delta = recentAvg - previousAvg;

        Trend trend;
        if (delta >= THRESHOLD - EPSILON) {
            trend = Trend.IMPROVING;
        } else if (delta <= -THRESHOLD + EPSILON) {
            trend = Trend.DECLINING;
        } else {
            trend = Trend.STABLE;
        }

        return new TrendAnalysis(trend, round(delta), round(recentAvg), round(previousAvg));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
