package org.nowstart.lotledger.service.ledger.classifier;

import org.nowstart.lotledger.data.type.RowErrorCode;

public record RowError(
        int rowNumber,
        RowErrorCode code,
        String message
) {
}
