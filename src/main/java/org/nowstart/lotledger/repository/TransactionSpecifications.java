package org.nowstart.lotledger.repository;

import java.time.LocalDate;
import java.util.Locale;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.type.EventKind;
import org.springframework.data.jpa.domain.Specification;

/**
 * Optional filters of the transaction listing. A {@code null} argument leaves its filter out.
 */
public final class TransactionSpecifications {

    private TransactionSpecifications() {
    }

    public static Specification<LedgerTransaction> filter(String symbol, EventKind kind, LocalDate from, LocalDate to) {
        return Specification.where(hasSymbol(symbol))
                .and(hasKind(kind))
                .and(onOrAfter(from))
                .and(onOrBefore(to));
    }

    static Specification<LedgerTransaction> hasSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        return (root, query, builder) -> builder.equal(root.get("symbol"), normalized);
    }

    static Specification<LedgerTransaction> hasKind(EventKind kind) {
        if (kind == null) {
            return null;
        }
        return (root, query, builder) -> builder.equal(root.get("kind"), kind);
    }

    static Specification<LedgerTransaction> onOrAfter(LocalDate from) {
        if (from == null) {
            return null;
        }
        return (root, query, builder) -> builder.greaterThanOrEqualTo(root.get("tradeDate"), from);
    }

    static Specification<LedgerTransaction> onOrBefore(LocalDate to) {
        if (to == null) {
            return null;
        }
        return (root, query, builder) -> builder.lessThanOrEqualTo(root.get("tradeDate"), to);
    }
}
