package org.nowstart.lotledger.repository;

import java.util.Collection;
import java.util.List;
import org.nowstart.lotledger.data.entity.LotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LotRecordRepository extends JpaRepository<LotRecord, Long> {

    List<LotRecord> findBySymbolOrderByOpenedDateAscLotIdAsc(String symbol);

    List<LotRecord> findByLotIdInAndCostPendingTrue(Collection<Long> lotIds);
}
