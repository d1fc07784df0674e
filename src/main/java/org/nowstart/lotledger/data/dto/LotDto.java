package org.nowstart.lotledger.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.nowstart.lotledger.data.type.EventKind;

public record LotDto(
        long lotId,
        String symbol,
        EventKind sourceKind,
        LocalDate openedDate,
        long openedQuantity,
        long remainingQuantity,
        BigDecimal unitCost,
        boolean costPending
) {
}
