package workforce.backend.scoring;

/**
 * Trend plus the window means it was derived from. Means and delta are null
 * when the trend is {@link Trend#INSUFFICIENT_DATA}.
 */
public record TrendAnalysis(Trend trend, Double delta, Double recentAvg, Double previousAvg) {

    public static TrendAnalysis insufficient() {
        return new TrendAnalysis(Trend.INSUFFICIENT_DATA, null, null, null);
    }
}
