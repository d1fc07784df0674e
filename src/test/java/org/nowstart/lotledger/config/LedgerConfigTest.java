package org.nowstart.lotledger.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import org.junit.jupiter.api.Test;
import org.nowstart.lotledger.data.property.LedgerProperties;
import org.nowstart.lotledger.service.ledger.classifier.EventClassifier;

class LedgerConfigTest {

    private final LedgerConfig config = new LedgerConfig();

    @Test
    void quoteSyncThreadFactory_namesDaemonThreadsInOrder() {
        ThreadFactory factory = LedgerConfig.quoteSyncThreadFactory();

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertThat(first.getName()).isEqualTo("quote-sync-1");
        assertThat(second.getName()).isEqualTo("quote-sync-2");
        assertThat(first.isDaemon()).isTrue();
    }

    @Test
    void quoteSyncExecutor_isUsableUntilShutdown() throws Exception {
        ExecutorService executor = config.quoteSyncExecutor(properties(List.of("yyyy-MM-dd")));
        try {
            assertThat(executor.submit(() -> Thread.currentThread().getName()).get()).startsWith("quote-sync-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void eventClassifier_usesConfiguredDateLayouts() {
        EventClassifier classifier = config.eventClassifier(properties(List.of("MM/dd/yyyy")));

        var result = classifier.classifyAll(
                List.of("Date", "Symbol", "Type", "Qty"),
                List.of(List.of("03/04/2024", "API", "ON-CR", "10"))
        );

        assertThat(result.rows().get(0).date()).isEqualTo(LocalDate.of(2024, 3, 4));
    }

    private static LedgerProperties properties(List<String> dateLayouts) {
        return new LedgerProperties(
                "http://localhost:8090",
                "",
                "X-API-KEY",
                true,
                Duration.ofMinutes(15),
                2,
                Duration.ofSeconds(30),
                dateLayouts,
                365L,
                200
        );
    }
}
