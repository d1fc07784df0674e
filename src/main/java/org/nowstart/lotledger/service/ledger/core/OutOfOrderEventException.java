package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;

public class OutOfOrderEventException extends LedgerInvariantException {

    public OutOfOrderEventException(String symbol, long sequence, LocalDate date, LocalDate lastDate, long lastSequence) {
        super(symbol, sequence, String.format(
                "%s #%d dated %s arrived after #%d dated %s; events must be applied in (date, sequence) order",
                symbol, sequence, date, lastSequence, lastDate));
    }
}
