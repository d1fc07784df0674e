package org.nowstart.lotledger.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.service.QuoteSyncService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QuoteSyncScheduler {

    private final QuoteSyncService quoteSyncService;
    private final LedgerProperties ledgerProperties;

    @Scheduled(fixedDelayString = "${lotledger.quote-sync-interval:15m}", initialDelayString = "${lotledger.quote-sync-interval:15m}")
    public void run() {
        if (!ledgerProperties.quoteSyncEnabled()) {
            return;
        }
        quoteSyncService.syncQuotes();
    }
}
