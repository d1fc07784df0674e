package org.nowstart.lotledger.data.exception;

import java.util.List;
import lombok.Getter;
import org.nowstart.lotledger.data.dto.ReplayFailureDto;
import org.springframework.http.HttpStatus;

/**
 * Replay stopped for one or more symbols. Nothing from the run is persisted.
 */
@Getter
public class LedgerReplayException extends LedgerApiException {

    private final List<ReplayFailureDto> failures;

    public LedgerReplayException(List<ReplayFailureDto> failures) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "ledger_invariant_violation",
                "Ledger replay failed for " + failures.size() + " symbol(s)");
        this.failures = List.copyOf(failures);
    }
}
