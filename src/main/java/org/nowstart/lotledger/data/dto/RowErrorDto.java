package org.nowstart.lotledger.data.dto;

import org.nowstart.lotledger.data.type.RowErrorCode;

public record RowErrorDto(
        int row,
        RowErrorCode code,
        String message
) {
}
