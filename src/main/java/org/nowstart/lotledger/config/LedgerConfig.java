package org.nowstart.lotledger.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.service.ledger.classifier.CsvExportReader;
import org.nowstart.lotledger.service.ledger.classifier.EventClassifier;
import org.nowstart.lotledger.service.valuation.PortfolioAggregator;
import org.nowstart.lotledger.service.valuation.ValuationEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfig {

    @Bean
    public EventClassifier eventClassifier(LedgerProperties ledgerProperties) {
        return new EventClassifier(ledgerProperties.dateLayouts());
    }

    @Bean
    public CsvExportReader csvExportReader() {
        return new CsvExportReader();
    }

    @Bean
    public ValuationEngine valuationEngine() {
        return new ValuationEngine();
    }

    @Bean
    public PortfolioAggregator portfolioAggregator() {
        return new PortfolioAggregator();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService quoteSyncExecutor(LedgerProperties ledgerProperties) {
        return Executors.newFixedThreadPool(ledgerProperties.quoteSyncConcurrency(), quoteSyncThreadFactory());
    }

    static ThreadFactory quoteSyncThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "quote-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
