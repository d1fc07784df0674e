package org.nowstart.lotledger.data.type;

public enum EventKind {
    BUY(Direction.ADD, true),
    IPO(Direction.ADD, true),
    SELL(Direction.REDUCE, true),
    BONUS(Direction.ADD, false),
    RIGHTS(Direction.ADD, false),
    MERGER_IN(Direction.ADD, false),
    MERGER_OUT(Direction.REDUCE, false),
    DEMAT(Direction.REDUCE, false),
    REARRANGEMENT(Direction.ADD, false),
    REARRANGEMENT_OUT(Direction.REDUCE, false);

    private final Direction direction;
    private final boolean cashFlow;

    EventKind(Direction direction, boolean cashFlow) {
        this.direction = direction;
        this.cashFlow = cashFlow;
    }

    public boolean addsShares() {
        return direction == Direction.ADD;
    }

    /**
     * Kinds whose rows settle against cash and therefore need a unit price before P&amp;L is known.
     */
    public boolean hasCashFlow() {
        return cashFlow;
    }

    /**
     * Kinds whose price may be supplied after import.
     */
    public boolean acceptsPrice() {
        return cashFlow || this == MERGER_IN;
    }

    private enum Direction {
        ADD,
        REDUCE
    }
}
