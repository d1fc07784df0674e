package org.nowstart.lotledger.data.dto;

import java.util.List;

public record ImportResultDto(
        int imported,
        int skipped,
        int duplicates,
        int unclassified,
        List<RowErrorDto> errors
) {
}
