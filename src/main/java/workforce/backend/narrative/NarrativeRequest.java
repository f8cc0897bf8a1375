package workforce.backend.narrative;

import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.TrendAnalysis;

/**
 * Inputs of a score explanation. Only pre-computed numbers are passed on,
 * the narrative never recomputes the score.
 */
public record NarrativeRequest(String employeeId, ScoreResult score, TrendAnalysis trend) {
}
