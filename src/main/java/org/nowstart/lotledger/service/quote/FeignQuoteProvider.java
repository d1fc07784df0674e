package org.nowstart.lotledger.service.quote;

import feign.FeignException;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.lotledger.data.dto.MarketQuoteResponse;
import org.nowstart.lotledger.repository.MarketDataFeignClient;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeignQuoteProvider implements QuoteProvider {

    private final MarketDataFeignClient marketDataFeignClient;

    @Override
    public Optional<Quote> latestQuote(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        MarketQuoteResponse response;
        try {
            response = marketDataFeignClient.getQuote(normalized);
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }

        if (response == null || response.last_traded_price() == null) {
            return Optional.empty();
        }
        Instant asOf = response.as_of() == null ? Instant.now() : response.as_of();
        return Optional.of(new Quote(normalized, Money.fromMajorUnits(response.last_traded_price()), asOf));
    }
}
