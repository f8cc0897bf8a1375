package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.service.LedgerStatus;

/**
 * GET /api/v1/ledger/status
 * totalLogged is a decimal string because uint256 does not fit a JSON number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerStatusResponse(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("signerAddress") String signerAddress,
        @JsonProperty("registered") boolean registered,
        @JsonProperty("totalLogged") String totalLogged,
        @JsonProperty("localEntries") int localEntries) {

    public static LedgerStatusResponse from(LedgerStatus status) {
        return new LedgerStatusResponse(
                status.enabled(),
                status.signerAddress(),
                status.registered(),
                status.totalLogged() != null ? status.totalLogged().toString() : null,
                status.localEntries());
    }
}
