package org.nowstart.lotledger.repository;

import java.util.List;
import org.nowstart.lotledger.data.entity.DisposalRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DisposalRecordRepository extends JpaRepository<DisposalRecord, Long> {

    List<DisposalRecord> findAllByOrderByDisposalDateAscTransactionIdAscIdAsc();

    List<DisposalRecord> findBySymbolOrderByDisposalDateAscTransactionIdAscIdAsc(String symbol);
}
