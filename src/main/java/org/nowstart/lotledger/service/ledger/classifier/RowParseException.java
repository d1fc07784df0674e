package org.nowstart.lotledger.service.ledger.classifier;

import lombok.Getter;
import org.nowstart.lotledger.data.type.RowErrorCode;

@Getter
public class RowParseException extends RuntimeException {

    private final int rowNumber;
    private final RowErrorCode code;

    public RowParseException(int rowNumber, RowErrorCode code, String message) {
        super(message);
        this.rowNumber = rowNumber;
        this.code = code;
    }

    public RowError toRowError() {
        return new RowError(rowNumber, code, getMessage());
    }
}
