package org.nowstart.lotledger.data.type;

public enum ValuationStatus {
    PRICED,
    PRICE_UNAVAILABLE,
    COST_PENDING
}
