package org.nowstart.lotledger.repository;

import java.util.List;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HoldingRecordRepository extends JpaRepository<HoldingRecord, String> {

    List<HoldingRecord> findAllByOrderBySymbolAsc();

    List<HoldingRecord> findByTotalQuantityGreaterThanOrderBySymbolAsc(long quantity);
}
