package org.nowstart.lotledger.data.type;

public enum RowErrorCode {
    MALFORMED_DATE,
    MISSING_SYMBOL,
    AMBIGUOUS_QUANTITY,
    MALFORMED_QUANTITY,
    MALFORMED_PRICE,
    UNEXPECTED_DIRECTION
}
