package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * Audit record of one disposal event drawing shares from one lot.
 *
 * @param proceeds  sale proceeds net of the pro-rated fee; {@code null} for non-cash reductions and
 *                  for sales still awaiting a price
 * @param costBasis cost drawn from the lot; {@code null} when the lot's cost is still pending
 * @param gain      {@code proceeds - costBasis}; {@code null} whenever either side is unknown
 */
public record RealizedDisposal(
        String symbol,
        long eventSequence,
        EventKind kind,
        LocalDate disposalDate,
        long lotId,
        LocalDate lotOpenedDate,
        long quantity,
        Money proceeds,
        Money costBasis,
        Money gain,
        long holdingDays,
        boolean longTerm
) {

    public boolean isRealized() {
        return gain != null;
    }
}
