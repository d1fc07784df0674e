package org.nowstart.lotledger.repository;

import org.nowstart.lotledger.data.entity.MarketQuote;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MarketQuoteRepository extends JpaRepository<MarketQuote, String> {
}
