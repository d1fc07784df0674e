package org.nowstart.lotledger.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lotledger")
public record LedgerProperties(
        // 시세 제공 API 기본 URL
        @NotBlank @DefaultValue("http://localhost:8090") String baseUrl,
        // 시세 제공 API 키 (비어 있으면 헤더를 보내지 않음)
        @DefaultValue("") String apiKey,
        // API 키를 실어 보낼 헤더 이름
        @NotBlank @DefaultValue("X-API-KEY") String apiKeyHeader,
        // 시세 동기화 스케줄러 사용 여부
        @DefaultValue("true") boolean quoteSyncEnabled,
        // 시세 동기화 실행 주기
        @NotNull @DefaultValue("15m") Duration quoteSyncInterval,
        // 시세 동기화 동시 요청 수
        @Positive @DefaultValue("5") int quoteSyncConcurrency,
        // 시세 동기화 전체 배치 제한 시간
        @NotNull @DefaultValue("30s") Duration quoteSyncTimeout,
        // 거래 내역 날짜 포맷(앞에서부터 순서대로 시도)
        @NotEmpty @DefaultValue({"yyyy-MM-dd", "yyyy/MM/dd", "dd-MM-yyyy", "dd/MM/yyyy", "yyyyMMdd", "yyyy-MM-dd HH:mm:ss"})
        List<String> dateLayouts,
        // 장기 보유로 보는 최소 보유 일수(초과 시 장기)
        @PositiveOrZero @DefaultValue("365") long longTermHoldingDays,
        // 거래 내역 조회 페이지 최대 크기
        @Positive @DefaultValue("200") int maxPageSize
) {
}
