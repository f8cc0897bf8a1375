package workforce.backend.scoring;

/**
 * Score, grade and breakdown of one employee. All three are null when
 * no task is assigned: "no data" is never reported as a zero score.
 */
public record ScoreResult(Double score, String grade, ScoreBreakdown breakdown) {

    public static ScoreResult absent() {
        return new ScoreResult(null, null, null);
    }

    public boolean isAbsent() {
        return score == null;
    }
}
