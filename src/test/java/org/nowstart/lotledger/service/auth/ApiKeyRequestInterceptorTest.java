package org.nowstart.lotledger.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import org.junit.jupiter.api.Test;

class ApiKeyRequestInterceptorTest {

    @Test
    void apply_addsApiKeyAndDefaultHeaders() {
        ApiKeyRequestInterceptor interceptor = new ApiKeyRequestInterceptor("X-API-KEY", "secret");
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/api/v1/quotes/NABIL");

        interceptor.apply(template);

        assertThat(headerValue(template, "X-API-KEY")).isEqualTo("secret");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
        assertThat(headerValue(template, "User-Agent")).isEqualTo("lotledger/1.0");
    }

    @Test
    void apply_omitsApiKeyWhenBlank() {
        ApiKeyRequestInterceptor interceptor = new ApiKeyRequestInterceptor("X-API-KEY", " ");
        RequestTemplate template = new RequestTemplate();

        interceptor.apply(template);

        assertThat(template.headers()).doesNotContainKey("X-API-KEY");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
    }

    private String headerValue(RequestTemplate template, String key) {
        return template.headers().get(key).iterator().next();
    }
}
