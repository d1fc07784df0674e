package org.nowstart.lotledger.service.ledger.classifier;

import java.time.LocalDate;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.service.ledger.core.LedgerEvent;
import org.nowstart.lotledger.service.ledger.core.Money;

/**
 * A broker export row after classification.
 *
 * @param unitPrice    {@code null} unless the export carried a price for a cash-flow row
 * @param unclassified the description matched no known keyword and the kind was inferred from direction
 */
public record ClassifiedRow(
        int rowNumber,
        long sequence,
        String symbol,
        LocalDate date,
        EventKind kind,
        long quantity,
        Money unitPrice,
        String description,
        LocalDate purchaseDate,
        boolean unclassified
) {

    public LedgerEvent toEvent() {
        return new LedgerEvent(symbol, date, kind, quantity, unitPrice, null, sequence, description, purchaseDate);
    }
}
