package org.nowstart.lotledger.data.dto;

public record ReplayFailureDto(
        String symbol,
        long transactionId,
        String message
) {
}
