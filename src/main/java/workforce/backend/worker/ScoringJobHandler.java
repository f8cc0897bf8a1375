package workforce.backend.worker;

import workforce.backend.model.Queue;
import workforce.backend.model.ScoreJobPayload;
import workforce.backend.service.ScoreService;

/**
 * Recomputes the score of the task's assignee and appends it to the history.
 * A rerun appends a second row with the same values.
 */
public class ScoringJobHandler implements JobHandler<ScoreJobPayload> {

    private final ScoreService scoreService;

    public ScoringJobHandler(ScoreService scoreService) {
        this.scoreService = scoreService;
    }

    @Override
    public Queue queue() {
        return Queue.SCORING;
    }

    @Override
    public Class<ScoreJobPayload> payloadType() {
        return ScoreJobPayload.class;
    }

    @Override
    public void handle(ScoreJobPayload payload) {
        payload.validate();
        scoreService.recordScore(payload.tenantId(), payload.employeeId());
    }
}
