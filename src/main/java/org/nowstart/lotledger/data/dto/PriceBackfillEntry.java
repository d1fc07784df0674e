package org.nowstart.lotledger.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Price for one stored row, addressed either by {@code transactionId} or by symbol, date and quantity.
 */
public record PriceBackfillEntry(
        Long transactionId,
        String symbol,
        LocalDate date,
        Long quantity,
        @NotNull(message = "unitPrice is required")
        @DecimalMin(value = "0", inclusive = false, message = "unitPrice must be greater than zero")
        BigDecimal unitPrice,
        @DecimalMin(value = "0", message = "fee must not be negative")
        BigDecimal fee
) {

    @JsonIgnore
    @AssertTrue(message = "either transactionId or symbol, date and quantity is required")
    public boolean isAddressed() {
        return transactionId != null || (symbol != null && !symbol.isBlank() && date != null && quantity != null);
    }
}
