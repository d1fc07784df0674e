package org.nowstart.lotledger.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ApiKeyRequestInterceptor implements RequestInterceptor {

    private final String headerName;
    private final String apiKey;

    @Override
    public void apply(RequestTemplate template) {
        if (apiKey != null && !apiKey.isBlank()) {
            template.header(headerName, apiKey);
        }
        template.header("Accept", "application/json");
        template.header("User-Agent", "lotledger/1.0");
    }
}
