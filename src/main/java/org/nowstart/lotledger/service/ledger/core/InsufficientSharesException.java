package org.nowstart.lotledger.service.ledger.core;

import lombok.Getter;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * A reduction asked for more shares than the symbol's open lots hold. Usually means a missing event
 * (an unrecorded bonus, for example) or rows applied out of order.
 */
@Getter
public class InsufficientSharesException extends LedgerInvariantException {

    private final EventKind kind;
    private final long requested;
    private final long available;

    public InsufficientSharesException(String symbol, long sequence, EventKind kind, long requested, long available) {
        super(symbol, sequence, String.format(
                "%s #%d %s needs %d shares but only %d are held", symbol, sequence, kind, requested, available));
        this.kind = kind;
        this.requested = requested;
        this.available = available;
    }
}
