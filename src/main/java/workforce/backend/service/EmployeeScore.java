package workforce.backend.service;

import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.TrendAnalysis;

/**
 * Read-only score view of one employee.
 *
 * @param narrativeSource {@code model} when the narrative model answered, {@code template} otherwise
 */
public record EmployeeScore(
        String employeeId,
        ScoreResult score,
        TrendAnalysis trend,
        String narrative,
        String narrativeSource) {

    public static final String SOURCE_MODEL = "model";
    public static final String SOURCE_TEMPLATE = "template";
}
