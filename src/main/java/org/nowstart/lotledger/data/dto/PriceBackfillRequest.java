package org.nowstart.lotledger.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record PriceBackfillRequest(
        @NotEmpty(message = "entries must not be empty")
        List<@Valid PriceBackfillEntry> entries
) {
}
