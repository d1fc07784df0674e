package org.nowstart.lotledger.data.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class DtoRecordsTest {

    @Test
    void priceBackfillEntry_isAddressedByIdOrNaturalKey() {
        PriceBackfillEntry byId = new PriceBackfillEntry(7L, null, null, null, new BigDecimal("100"), null);
        PriceBackfillEntry byKey = new PriceBackfillEntry(null, "API", LocalDate.of(2025, 6, 22), 50L,
                new BigDecimal("100"), null);
        PriceBackfillEntry partialKey = new PriceBackfillEntry(null, "API", LocalDate.of(2025, 6, 22), null,
                new BigDecimal("100"), null);
        PriceBackfillEntry blankSymbol = new PriceBackfillEntry(null, " ", LocalDate.of(2025, 6, 22), 50L,
                new BigDecimal("100"), null);

        assertThat(byId.isAddressed()).isTrue();
        assertThat(byKey.isAddressed()).isTrue();
        assertThat(partialKey.isAddressed()).isFalse();
        assertThat(blankSymbol.isAddressed()).isFalse();
    }

    @Test
    void transactionPageDto_keepsPagingMetadata() {
        TransactionPageDto page = new TransactionPageDto(List.of(), 2, 50, 120L, 3);

        assertThat(page.content()).isEmpty();
        assertThat(page.page()).isEqualTo(2);
        assertThat(page.size()).isEqualTo(50);
        assertThat(page.totalElements()).isEqualTo(120L);
        assertThat(page.totalPages()).isEqualTo(3);
    }
}
