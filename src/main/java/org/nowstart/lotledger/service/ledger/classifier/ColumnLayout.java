package org.nowstart.lotledger.service.ledger.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Column positions resolved from an export header. Matching ignores case, whitespace, punctuation and
 * column order. A missing optional column has index {@code -1}.
 */
public record ColumnLayout(
        int date,
        int symbol,
        int description,
        int credit,
        int debit,
        int signedQuantity,
        int price
) {

    static final int ABSENT = -1;

    private static final Set<String> DATE_ALIASES = aliases("transaction date", "date", "trade date", "txn date");
    private static final Set<String> SYMBOL_ALIASES = aliases("scrip", "symbol", "stock symbol", "ticker", "scrip name");
    private static final Set<String> DESCRIPTION_ALIASES = aliases(
            "history description", "description", "remarks", "type", "transaction type", "particulars");
    private static final Set<String> CREDIT_ALIASES = aliases("credit quantity", "credit", "credit qty");
    private static final Set<String> DEBIT_ALIASES = aliases("debit quantity", "debit", "debit qty");
    private static final Set<String> SIGNED_QUANTITY_ALIASES = aliases("quantity", "qty", "trade qty");
    private static final Set<String> PRICE_ALIASES = aliases("price", "rate", "unit price", "price(npr)");

    public static ColumnLayout fromHeader(List<String> header) {
        if (header == null) {
            throw new InvalidHeaderException(List.of("date", "symbol", "description", "quantity"));
        }
        int date = ABSENT;
        int symbol = ABSENT;
        int description = ABSENT;
        int credit = ABSENT;
        int debit = ABSENT;
        int signedQuantity = ABSENT;
        int price = ABSENT;

        for (int i = 0; i < header.size(); i++) {
            String name = normalize(header.get(i));
            if (date == ABSENT && DATE_ALIASES.contains(name)) {
                date = i;
            } else if (symbol == ABSENT && SYMBOL_ALIASES.contains(name)) {
                symbol = i;
            } else if (description == ABSENT && DESCRIPTION_ALIASES.contains(name)) {
                description = i;
            } else if (credit == ABSENT && CREDIT_ALIASES.contains(name)) {
                credit = i;
            } else if (debit == ABSENT && DEBIT_ALIASES.contains(name)) {
                debit = i;
            } else if (signedQuantity == ABSENT && SIGNED_QUANTITY_ALIASES.contains(name)) {
                signedQuantity = i;
            } else if (price == ABSENT && PRICE_ALIASES.contains(name)) {
                price = i;
            }
        }

        List<String> missing = new ArrayList<>();
        if (date == ABSENT) {
            missing.add("date");
        }
        if (symbol == ABSENT) {
            missing.add("symbol");
        }
        if (description == ABSENT) {
            missing.add("description");
        }
        if (credit == ABSENT && debit == ABSENT && signedQuantity == ABSENT) {
            missing.add("quantity");
        }
        if (!missing.isEmpty()) {
            throw new InvalidHeaderException(missing);
        }
        return new ColumnLayout(date, symbol, description, credit, debit, signedQuantity, price);
    }

    public boolean hasDirectionalQuantities() {
        return credit != ABSENT || debit != ABSENT;
    }

    public boolean hasPrice() {
        return price != ABSENT;
    }

    /**
     * Trimmed cell value, or an empty string when the column is absent or the row is short.
     */
    public String value(List<String> fields, int index) {
        if (index == ABSENT || fields == null || index >= fields.size()) {
            return "";
        }
        String value = fields.get(index);
        return value == null ? "" : value.trim();
    }

    static String normalize(String column) {
        if (column == null) {
            return "";
        }
        return column.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private static Set<String> aliases(String... names) {
        List<String> normalized = new ArrayList<>(names.length);
        for (String name : names) {
            normalized.add(normalize(name));
        }
        return Set.copyOf(normalized);
    }
}
