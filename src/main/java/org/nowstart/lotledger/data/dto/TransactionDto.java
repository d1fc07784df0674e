package org.nowstart.lotledger.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.nowstart.lotledger.data.type.EventKind;

public record TransactionDto(
        long id,
        String symbol,
        LocalDate date,
        EventKind kind,
        long quantity,
        BigDecimal unitPrice,
        BigDecimal fee,
        String description,
        LocalDate purchaseDate,
        boolean unclassified
) {
}
