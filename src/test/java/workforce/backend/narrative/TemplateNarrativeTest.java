package workforce.backend.narrative;

import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.Trend;
import workforce.backend.scoring.TrendAnalysis;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateNarrativeTest {

    private static final ScoreResult SCORE =
            new ScoreResult(85.8, "A", new ScoreBreakdown(0.9, 0.85, 4.0, 10, 9, 7));

    @Test
    void describesEveryFactor() {
        String text = TemplateNarrative.explain(new NarrativeRequest("emp-1", SCORE, TrendAnalysis.insufficient()));

        assertEquals("Score 85.8 (grade A). Completed 9 of 10 assigned tasks (90%). "
                + "85% of completed tasks with a deadline were on time. Average complexity is 4.0 of 5. "
                + "There is not enough history yet to show a trend.", text);
    }

    @Test
    void mentionsMissingDeadlines() {
        ScoreResult noDeadlines = new ScoreResult(60.0, "C", new ScoreBreakdown(1.0, null, 4.0, 2, 2, 0));

        String text = TemplateNarrative.explain(new NarrativeRequest("emp-1", noDeadlines, null));

        assertTrue(text.contains("punctuality did not add to the score"), text);
    }

    @Test
    void describesTrendDirection() {
        String declining = TemplateNarrative.explain(new NarrativeRequest("emp-1", SCORE,
                new TrendAnalysis(Trend.DECLINING, -3.5, 80.0, 83.5)));

        assertTrue(declining.endsWith("the 30-day average fell by 3.5 points."), declining);
    }

    @Test
    void absentScore() {
        String text = TemplateNarrative.explain(new NarrativeRequest("emp-1", ScoreResult.absent(), null));

        assertEquals("No tasks are assigned yet, so there is no score to explain.", text);
    }

    @Test
    void deterministic() {
        NarrativeRequest request = new NarrativeRequest("emp-1", SCORE,
                new TrendAnalysis(Trend.IMPROVING, 2.0, 81.0, 79.0));

        assertEquals(TemplateNarrative.explain(request), TemplateNarrative.explain(request));
    }
}
