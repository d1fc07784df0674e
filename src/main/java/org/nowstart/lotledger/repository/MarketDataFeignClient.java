package org.nowstart.lotledger.repository;

import org.nowstart.lotledger.config.MarketDataFeignConfig;
import org.nowstart.lotledger.data.dto.MarketQuoteResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "marketDataClient",
        url = "${lotledger.base-url}",
        configuration = MarketDataFeignConfig.class
)
public interface MarketDataFeignClient {

    @GetMapping("/api/v1/quotes/{symbol}")
    MarketQuoteResponse getQuote(@PathVariable("symbol") String symbol);
}
