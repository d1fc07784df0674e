package org.nowstart.lotledger.service.ledger.core;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Locale;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * One normalized economic event for one symbol. Direction comes from {@link #kind()}; the quantity is
 * always a positive magnitude.
 *
 * @param unitPrice    price per share, only for kinds with a cash flow or a caller-supplied merger
 *                     cost; {@code null} when absent
 * @param fee          broker charges deducted from disposal proceeds; {@code null} when not tracked
 * @param sequence     stable tie-breaker for events sharing a date
 * @param purchaseDate original acquisition date carried by rearrangement memos, otherwise {@code null}
 */
public record LedgerEvent(
        String symbol,
        LocalDate date,
        EventKind kind,
        long quantity,
        Money unitPrice,
        Money fee,
        long sequence,
        String memo,
        LocalDate purchaseDate
) {

    public static final Comparator<LedgerEvent> CHRONOLOGICAL = Comparator
            .comparing(LedgerEvent::date)
            .thenComparingLong(LedgerEvent::sequence);

    public LedgerEvent {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (quantity <= 0L) {
            throw new IllegalArgumentException("quantity must be positive, got " + quantity);
        }
        if (unitPrice != null && unitPrice.isNegative()) {
            throw new IllegalArgumentException("unitPrice must not be negative");
        }
        if (fee != null && fee.isNegative()) {
            throw new IllegalArgumentException("fee must not be negative");
        }
        memo = memo == null ? "" : memo;
    }

    public static LedgerEvent of(String symbol, LocalDate date, EventKind kind, long quantity, Money unitPrice, long sequence) {
        return new LedgerEvent(symbol, date, kind, quantity, unitPrice, null, sequence, "", null);
    }

    public boolean hasPrice() {
        return unitPrice != null;
    }

    public LedgerEvent withUnitPrice(Money price) {
        return new LedgerEvent(symbol, date, kind, quantity, price, fee, sequence, memo, purchaseDate);
    }
}
