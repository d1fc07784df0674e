package org.nowstart.lotledger.service.ledger.classifier;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.data.type.RowErrorCode;
import org.nowstart.lotledger.service.ledger.core.Money;

/**
 * Turns raw export rows into typed ledger rows. Holds no state besides its date layouts; performs no I/O.
 *
 * <p>Rows are classified independently. A bad row yields a {@link RowError} and never stops the rest of
 * the file.
 */
@Slf4j
public class EventClassifier {

    public static final List<String> DEFAULT_DATE_LAYOUTS = List.of(
            "yyyy-MM-dd",
            "yyyy/MM/dd",
            "dd-MM-yyyy",
            "dd/MM/yyyy",
            "yyyyMMdd",
            "yyyy-MM-dd HH:mm:ss"
    );

    private static final String PURCHASE_MARKER = "PUR ";
    private static final int MEMO_DATE_LENGTH = 10;

    private final List<DateTimeFormatter> dateFormatters;

    public EventClassifier() {
        this(DEFAULT_DATE_LAYOUTS);
    }

    public EventClassifier(List<String> dateLayouts) {
        List<String> layouts = dateLayouts == null || dateLayouts.isEmpty() ? DEFAULT_DATE_LAYOUTS : dateLayouts;
        this.dateFormatters = layouts.stream()
                .map(layout -> DateTimeFormatter.ofPattern(layout.replace("yyyy", "uuuu"), Locale.ROOT)
                        .withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }

    /**
     * Classifies every data row. Row numbers are 1-based and count data rows only; the sequence of a row
     * is {@code firstSequence} plus its position.
     */
    public ClassificationResult classifyAll(List<String> header, List<List<String>> rows, long firstSequence) {
        ColumnLayout layout = ColumnLayout.fromHeader(header);
        List<ClassifiedRow> classified = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            try {
                classified.add(classify(rows.get(i), layout, i + 1, firstSequence + i));
            } catch (RowParseException e) {
                log.warn("event=row_rejected row={} code={} reason={}", e.getRowNumber(), e.getCode(), e.getMessage());
                errors.add(e.toRowError());
            }
        }
        return new ClassificationResult(classified, errors);
    }

    public ClassificationResult classifyAll(List<String> header, List<List<String>> rows) {
        return classifyAll(header, rows, 1L);
    }

    /**
     * @throws RowParseException when the row cannot become a ledger event
     */
    public ClassifiedRow classify(List<String> fields, ColumnLayout layout, int rowNumber, long sequence) {
        LocalDate date = parseDate(layout.value(fields, layout.date()))
                .orElseThrow(() -> new RowParseException(rowNumber, RowErrorCode.MALFORMED_DATE,
                        "unrecognized date '" + layout.value(fields, layout.date()) + "'"));

        String symbol = layout.value(fields, layout.symbol()).toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new RowParseException(rowNumber, RowErrorCode.MISSING_SYMBOL, "symbol is empty");
        }

        SignedQuantity quantity = resolveQuantity(fields, layout, rowNumber);
        String description = layout.value(fields, layout.description());

        Optional<ClassificationRule> rule = ClassificationRule.match(description);
        EventKind kind;
        if (rule.isPresent()) {
            boolean credit = quantity.explicit()
                    ? quantity.credit()
                    : rule.get().impliedCredit().orElse(quantity.credit());
            kind = rule.get().kindFor(credit)
                    .orElseThrow(() -> new RowParseException(rowNumber, RowErrorCode.UNEXPECTED_DIRECTION,
                            rule.get() + " rows cannot be " + (credit ? "credits" : "debits")
                                    + ", got " + quantity.amount() + " shares"));
        } else {
            kind = quantity.credit() ? EventKind.BUY : EventKind.SELL;
            log.warn("event=unclassified_row row={} symbol={} inferred_kind={} description=\"{}\"",
                    rowNumber, symbol, kind, description);
        }

        Money unitPrice = kind.hasCashFlow() ? parsePrice(layout.value(fields, layout.price()), rowNumber) : null;

        return new ClassifiedRow(
                rowNumber,
                sequence,
                symbol,
                date,
                kind,
                quantity.amount(),
                unitPrice,
                description,
                purchaseDate(description).orElse(null),
                rule.isEmpty()
        );
    }

    Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : dateFormatters) {
            try {
                return Optional.of(formatter.parse(value.trim(), LocalDate::from));
            } catch (DateTimeParseException e) {
                log.trace("date '{}' does not match {}", value, formatter);
            }
        }
        return Optional.empty();
    }

    /**
     * Original acquisition date from a {@code PUR <date>} memo fragment, such as the one broker rows
     * for unit rearrangements carry.
     */
    Optional<LocalDate> purchaseDate(String description) {
        if (description == null) {
            return Optional.empty();
        }
        int marker = description.toUpperCase(Locale.ROOT).indexOf(PURCHASE_MARKER);
        if (marker < 0) {
            return Optional.empty();
        }
        String rest = description.substring(marker + PURCHASE_MARKER.length()).trim();
        if (rest.length() < MEMO_DATE_LENGTH) {
            return Optional.empty();
        }
        return parseDate(rest.substring(0, MEMO_DATE_LENGTH));
    }

    private SignedQuantity resolveQuantity(List<String> fields, ColumnLayout layout, int rowNumber) {
        if (layout.hasDirectionalQuantities()) {
            long credit = parseQuantity(layout.value(fields, layout.credit()), rowNumber);
            long debit = parseQuantity(layout.value(fields, layout.debit()), rowNumber);
            if (credit < 0L || debit < 0L) {
                throw new RowParseException(rowNumber, RowErrorCode.MALFORMED_QUANTITY,
                        "credit and debit quantities must not be negative");
            }
            if ((credit > 0L) == (debit > 0L)) {
                throw new RowParseException(rowNumber, RowErrorCode.AMBIGUOUS_QUANTITY,
                        "exactly one of credit or debit must be populated, got credit=" + credit + " debit=" + debit);
            }
            return credit > 0L ? new SignedQuantity(credit, true, true) : new SignedQuantity(debit, false, true);
        }

        long signed = parseQuantity(layout.value(fields, layout.signedQuantity()), rowNumber);
        if (signed == 0L) {
            throw new RowParseException(rowNumber, RowErrorCode.AMBIGUOUS_QUANTITY, "quantity is empty or zero");
        }
        return new SignedQuantity(Math.abs(signed), signed > 0L, signed < 0L);
    }

    private long parseQuantity(String value, int rowNumber) {
        if (value.isEmpty() || "-".equals(value)) {
            return 0L;
        }
        try {
            BigDecimal parsed = new BigDecimal(value.replace(",", "")).stripTrailingZeros();
            if (parsed.scale() > 0) {
                throw new RowParseException(rowNumber, RowErrorCode.MALFORMED_QUANTITY,
                        "quantity must be a whole number of shares, got '" + value + "'");
            }
            return parsed.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new RowParseException(rowNumber, RowErrorCode.MALFORMED_QUANTITY, "unreadable quantity '" + value + "'");
        }
    }

    /**
     * Blank, {@code -} and zero mean the export did not know the price.
     */
    private Money parsePrice(String value, int rowNumber) {
        if (value.isEmpty() || "-".equals(value)) {
            return null;
        }
        Money price;
        try {
            price = Money.fromMajorUnits(value);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new RowParseException(rowNumber, RowErrorCode.MALFORMED_PRICE, "unreadable price '" + value + "'");
        }
        if (price.isNegative()) {
            throw new RowParseException(rowNumber, RowErrorCode.MALFORMED_PRICE, "price must not be negative");
        }
        return price.isZero() ? null : price;
    }

    /**
     * {@code explicit} is false for an unsigned value in a single quantity column, whose direction then
     * comes from the description.
     */
    private record SignedQuantity(long amount, boolean credit, boolean explicit) {
    }
}
