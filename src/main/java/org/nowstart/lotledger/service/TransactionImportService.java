package org.nowstart.lotledger.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lotledger.data.dto.ImportResultDto;
import org.nowstart.lotledger.data.dto.RowErrorDto;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.exception.LedgerApiException;
import org.nowstart.lotledger.repository.LedgerTransactionRepository;
import org.nowstart.lotledger.service.ledger.classifier.ClassificationResult;
import org.nowstart.lotledger.service.ledger.classifier.ClassifiedRow;
import org.nowstart.lotledger.service.ledger.classifier.CsvExportReader;
import org.nowstart.lotledger.service.ledger.classifier.EventClassifier;
import org.nowstart.lotledger.service.ledger.classifier.RowError;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionImportService {

    private final CsvExportReader csvExportReader;
    private final EventClassifier eventClassifier;
    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final LedgerRebuildService ledgerRebuildService;

    /**
     * Stores the rows of a broker export that are not stored yet and rebuilds the ledger. Importing the
     * same export twice adds nothing the second time. Identical rows within one export are kept as
     * separate trades.
     */
    @Transactional
    public ImportResultDto importCsv(byte[] content) {
        CsvExportReader.CsvExport export = csvExportReader.read(content);
        if (export.header().isEmpty()) {
            throw new LedgerApiException(HttpStatus.BAD_REQUEST, "empty_import", "Import file has no header row");
        }

        ClassificationResult result = eventClassifier.classifyAll(export.header(), export.rows());
        List<ClassifiedRow> rows = inBookingOrder(result.rows());

        // identical rows are real repeated trades; only as many as are already stored count as duplicates
        Map<TransactionKey, Integer> storedCounts = new HashMap<>();
        Set<String> symbols = new TreeSet<>();
        rows.forEach(row -> symbols.add(row.symbol()));
        if (!symbols.isEmpty()) {
            for (LedgerTransaction stored : ledgerTransactionRepository.findBySymbolIn(symbols)) {
                storedCounts.merge(TransactionKey.of(stored), 1, Integer::sum);
            }
        }

        Map<TransactionKey, Integer> fileCounts = new HashMap<>();
        List<LedgerTransaction> imported = new ArrayList<>();
        int duplicates = 0;
        int unclassified = 0;
        for (ClassifiedRow row : rows) {
            TransactionKey key = TransactionKey.of(row);
            int occurrence = fileCounts.merge(key, 1, Integer::sum);
            if (occurrence <= storedCounts.getOrDefault(key, 0)) {
                duplicates++;
                continue;
            }
            if (row.unclassified()) {
                unclassified++;
            }
            imported.add(toTransaction(row));
        }

        if (!imported.isEmpty()) {
            ledgerTransactionRepository.saveAll(imported);
            ledgerRebuildService.rebuild();
        }

        List<RowErrorDto> errors = result.errors().stream()
                .map(this::toRowErrorDto)
                .toList();
        log.info(
                "event=import_complete rows={} imported={} duplicates={} skipped={} unclassified={}",
                export.rows().size(),
                imported.size(),
                duplicates,
                errors.size(),
                unclassified
        );
        return new ImportResultDto(imported.size(), errors.size(), duplicates, unclassified, errors);
    }

    /**
     * Broker exports usually list the newest row first. Stored ids are the replay tie-breaker for rows
     * sharing a date, so such exports are stored oldest first.
     */
    private List<ClassifiedRow> inBookingOrder(List<ClassifiedRow> rows) {
        if (rows.size() < 2) {
            return rows;
        }
        LocalDate first = rows.get(0).date();
        LocalDate last = rows.get(rows.size() - 1).date();
        if (!first.isAfter(last)) {
            return rows;
        }
        List<ClassifiedRow> reversed = new ArrayList<>(rows);
        Collections.reverse(reversed);
        return reversed;
    }

    private LedgerTransaction toTransaction(ClassifiedRow row) {
        return LedgerTransaction.builder()
                .symbol(row.symbol())
                .tradeDate(row.date())
                .kind(row.kind())
                .quantity(row.quantity())
                .unitPrice(row.unitPrice() == null ? null : row.unitPrice().toMajorUnits())
                .description(row.description())
                .purchaseDate(row.purchaseDate())
                .unclassified(row.unclassified())
                .build();
    }

    private RowErrorDto toRowErrorDto(RowError error) {
        return new RowErrorDto(error.rowNumber(), error.code(), error.message());
    }

    record TransactionKey(String symbol, LocalDate date, String description, long quantity) {

        static TransactionKey of(LedgerTransaction transaction) {
            return new TransactionKey(
                    transaction.getSymbol(),
                    transaction.getTradeDate(),
                    normalize(transaction.getDescription()),
                    transaction.getQuantity()
            );
        }

        static TransactionKey of(ClassifiedRow row) {
            return new TransactionKey(row.symbol(), row.date(), normalize(row.description()), row.quantity());
        }

        private static String normalize(String description) {
            return description == null ? "" : description.trim().replaceAll("\\s+", " ");
        }
    }
}
