package org.nowstart.lotledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.lotledger.data.dto.ReplayFailureDto;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.data.exception.LedgerReplayException;
import org.nowstart.lotledger.service.ledger.classifier.InvalidHeaderException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class LedgerExceptionHandlerTest {

    private final LedgerExceptionHandler handler = new LedgerExceptionHandler();

    @Test
    void handleLedgerApiException_returnsProblemDetailWithCode() {
        LedgerApiException exception = new LedgerApiException(HttpStatus.NOT_FOUND, "holding_not_found", "No holding for symbol XYZ");

        ProblemDetail detail = handler.handleLedgerApiException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(detail.getDetail()).isEqualTo("No holding for symbol XYZ");
        assertThat(detail.getProperties()).containsEntry("code", "holding_not_found");
        assertThat(detail.getProperties()).doesNotContainKey("failures");
    }

    @Test
    void handleLedgerApiException_listsReplayFailures() {
        List<ReplayFailureDto> failures = List.of(
                new ReplayFailureDto("API", 7L, "API #7 SELL needs 20 shares but only 15 are held"));

        ProblemDetail detail = handler.handleLedgerApiException(new LedgerReplayException(failures));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getProperties()).containsEntry("code", "ledger_invariant_violation");
        assertThat(detail.getProperties()).containsEntry("failures", failures);
    }

    @Test
    void handleInvalidHeaderException_listsMissingColumns() {
        ProblemDetail detail = handler.handleInvalidHeaderException(new InvalidHeaderException(List.of("date", "quantity")));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getProperties()).containsEntry("code", "invalid_header");
        assertThat(detail.getProperties()).containsEntry("missingColumns", List.of("date", "quantity"));
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleFeignException_includesUpstreamBodyAndStatus() {
        Request request = Request.create(
                Request.HttpMethod.GET,
                "/api/v1/quotes/NABIL",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(401)
                .reason("Unauthorized")
                .request(request)
                .headers(Map.of())
                .body("{\"error\":\"invalid_api_key\"}", StandardCharsets.UTF_8)
                .build();
        FeignException exception = FeignException.errorStatus("MarketDataFeignClient#getQuote", response);

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED.value());
        assertThat(detail.getDetail()).contains("invalid_api_key");
        assertThat(detail.getProperties()).containsEntry("code", "market_data_error");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 401);
    }

    @Test
    void handleFeignException_fallsBackToBadGatewayWhenStatusUnknown() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(520);
        when(exception.contentUTF8()).thenReturn("{\"error\":\"upstream\"}");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
        assertThat(detail.getDetail()).contains("upstream");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 520);
    }

    @Test
    void handleFeignException_usesDefaultDetailWhenBodyAndMessageBlank() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(400);
        when(exception.contentUTF8()).thenReturn(" ");
        when(exception.getMessage()).thenReturn(" ");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getDetail()).isEqualTo("Market data request failed");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "entries", "entries must not be empty"));
        MethodParameter methodParameter = new MethodParameter(
                LedgerExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );
        MethodArgumentNotValidException exception = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ProblemDetail detail = handler.handleValidationException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("entries must not be empty"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("unitPrice must be greater than 0");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("details", List.of("unitPrice must be greater than 0"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static final class ValidationTarget {
        private List<String> entries;
    }
}
