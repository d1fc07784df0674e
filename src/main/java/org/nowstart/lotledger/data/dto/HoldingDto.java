package org.nowstart.lotledger.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.lotledger.data.type.ValuationStatus;

public record HoldingDto(
        String symbol,
        long quantity,
        BigDecimal totalCost,
        BigDecimal averageCost,
        BigDecimal realizedPnl,
        boolean costPending,
        BigDecimal lastPrice,
        Instant quotedAt,
        BigDecimal currentValue,
        BigDecimal unrealizedPnl,
        Double unrealizedPnlPercent,
        ValuationStatus status
) {
}
