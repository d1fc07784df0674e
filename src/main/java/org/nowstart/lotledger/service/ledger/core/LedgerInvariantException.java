package org.nowstart.lotledger.service.ledger.core;

import lombok.Getter;

/**
 * Replay of one symbol cannot continue. Distinct from row parse errors, which never reach the ledger.
 */
@Getter
public class LedgerInvariantException extends RuntimeException {

    private final String symbol;
    private final long sequence;

    public LedgerInvariantException(String symbol, long sequence, String message) {
        super(message);
        this.symbol = symbol;
        this.sequence = sequence;
    }
}
