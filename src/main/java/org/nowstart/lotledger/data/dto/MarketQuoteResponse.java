package org.nowstart.lotledger.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketQuoteResponse(
        String symbol,
        BigDecimal last_traded_price,
        Instant as_of
) {
}
