package org.nowstart.lotledger.service.ledger.core;

import lombok.Getter;

@Getter
public class MoneyUnderflowException extends ArithmeticException {

    private final Money minuend;
    private final Money subtrahend;

    public MoneyUnderflowException(Money minuend, Money subtrahend) {
        super("Amount would become negative: " + minuend + " - " + subtrahend);
        this.minuend = minuend;
        this.subtrahend = subtrahend;
    }
}
