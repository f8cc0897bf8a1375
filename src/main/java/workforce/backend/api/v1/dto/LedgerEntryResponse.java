package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.LedgerEntry;

import java.time.Instant;

/**
 * Response DTO for a ledger record, without the tenant id.
 * GET /api/v1/ledger/entries
 */
public record LedgerEntryResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("txReference") String txReference,
        @JsonProperty("eventKind") String eventKind,
        @JsonProperty("loggedAt") Instant loggedAt) {

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(entry.taskId(), entry.txReference(), entry.eventKind(), entry.loggedAt());
    }
}
