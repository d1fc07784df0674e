package org.nowstart.lotledger.service.quote;

import java.time.Instant;
import org.nowstart.lotledger.service.ledger.core.Money;

public record Quote(
        String symbol,
        Money lastPrice,
        Instant asOf
) {

    public Quote {
        if (lastPrice == null || lastPrice.isNegative()) {
            throw new IllegalArgumentException("lastPrice must be present and not negative");
        }
    }
}
