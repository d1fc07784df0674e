package org.nowstart.lotledger.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.nowstart.lotledger.data.type.EventKind;

public record DisposalDto(
        long transactionId,
        String symbol,
        EventKind kind,
        LocalDate disposalDate,
        long lotId,
        LocalDate lotOpenedDate,
        long quantity,
        BigDecimal proceeds,
        BigDecimal costBasis,
        BigDecimal gain,
        long holdingDays,
        boolean longTerm
) {
}
