package org.nowstart.lotledger.data.dto;

import java.math.BigDecimal;

public record PortfolioSummaryDto(
        BigDecimal totalInvestment,
        BigDecimal currentValue,
        BigDecimal totalUnrealizedPnl,
        Double totalUnrealizedPnlPercent,
        BigDecimal totalRealizedPnl,
        int holdingsCount,
        int pricedCount,
        int priceUnavailableCount,
        int costPendingCount
) {
}
