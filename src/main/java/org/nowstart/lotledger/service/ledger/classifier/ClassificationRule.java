package org.nowstart.lotledger.service.ledger.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.nowstart.lotledger.data.type.EventKind;

/**
 * Description keywords mapped to event kinds, evaluated in declaration order. Keywords match whole
 * words only, so {@code DEM} never matches inside {@code DEMAT}.
 */
enum ClassificationRule {
    IPO(EventKind.IPO, null, "INITIAL PUBLIC OFFERING", "IPO"),
    BONUS(EventKind.BONUS, null, "CA-BONUS", "BONUS"),
    RIGHTS(EventKind.RIGHTS, null, "CA-RIGHTS", "RIGHTS"),
    MERGER(EventKind.MERGER_IN, EventKind.MERGER_OUT, "CA-MERGER", "MERGER"),
    REARRANGEMENT(EventKind.REARRANGEMENT, EventKind.REARRANGEMENT_OUT, "CA-REARRANGEMENT", "REARRANGEMENT"),
    DEMAT(EventKind.BUY, EventKind.DEMAT, "DEMAT", "DEM"),
    REGULAR_CREDIT(EventKind.BUY, null, "ON-CR"),
    REGULAR_DEBIT(null, EventKind.SELL, "ON-DR"),
    PURCHASE(EventKind.BUY, null, "BUY", "PURCHASE", "BOUGHT"),
    SALE(null, EventKind.SELL, "SELL", "SALE", "SOLD");

    private final EventKind creditKind;
    private final EventKind debitKind;
    private final List<Pattern> patterns;

    ClassificationRule(EventKind creditKind, EventKind debitKind, String... keywords) {
        this.creditKind = creditKind;
        this.debitKind = debitKind;
        this.patterns = Arrays.stream(keywords)
                .map(keyword -> Pattern.compile("(?<![A-Z0-9])" + Pattern.quote(keyword) + "(?![A-Z0-9])"))
                .toList();
    }

    static Optional<ClassificationRule> match(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        String upper = description.toUpperCase(Locale.ROOT);
        for (ClassificationRule rule : values()) {
            if (rule.matches(upper)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Kind for the populated side, empty when this rule does not allow that direction.
     */
    Optional<EventKind> kindFor(boolean credit) {
        return Optional.ofNullable(credit ? creditKind : debitKind);
    }

    /**
     * Direction named by the rule itself, empty for rules that allow both sides.
     */
    Optional<Boolean> impliedCredit() {
        if (creditKind != null && debitKind == null) {
            return Optional.of(true);
        }
        if (creditKind == null && debitKind != null) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private boolean matches(String upperDescription) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(upperDescription).find()) {
                return true;
            }
        }
        return false;
    }
}
