package org.nowstart.lotledger.data.dto;

public record PriceBackfillResultDto(
        int updated,
        int alreadyPriced,
        int notPriceable,
        int notFound
) {
}
