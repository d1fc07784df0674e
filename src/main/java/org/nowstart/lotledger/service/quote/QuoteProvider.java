package org.nowstart.lotledger.service.quote;

import java.util.Optional;

/**
 * Source of the latest traded price of a symbol.
 */
public interface QuoteProvider {

    /**
     * @return the quote, or empty when the provider does not know the symbol
     * @throws RuntimeException when the provider cannot be reached; callers treat the symbol as unpriced
     */
    Optional<Quote> latestQuote(String symbol);
}
