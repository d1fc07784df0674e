package org.nowstart.lotledger.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.type.EventKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long>,
        JpaSpecificationExecutor<LedgerTransaction> {

    List<LedgerTransaction> findAllByOrderByTradeDateAscIdAsc();

    List<LedgerTransaction> findBySymbolIn(Collection<String> symbols);

    List<LedgerTransaction> findBySymbolAndTradeDateAndQuantityOrderByIdAsc(String symbol, LocalDate tradeDate, long quantity);

    List<LedgerTransaction> findByUnitPriceIsNullAndKindInOrderByTradeDateAscIdAsc(Collection<EventKind> kinds);
}
