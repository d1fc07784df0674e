package org.nowstart.lotledger.config;

import feign.RequestInterceptor;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.service.auth.ApiKeyRequestInterceptor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MarketDataFeignConfig {

    @Bean
    @RefreshScope
    public RequestInterceptor marketDataApiKeyInterceptor(LedgerProperties ledgerProperties) {
        return new ApiKeyRequestInterceptor(ledgerProperties.apiKeyHeader(), ledgerProperties.apiKey());
    }
}
