package org.nowstart.lotledger.data.dto;

import java.util.List;

public record QuoteSyncResultDto(
        int requested,
        int updated,
        int failed,
        List<String> errors
) {
}
