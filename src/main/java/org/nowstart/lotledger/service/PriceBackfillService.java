package org.nowstart.lotledger.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.lotledger.data.dto.PriceBackfillEntry;
import org.nowstart.lotledger.data.dto.PriceBackfillRequest;
import org.nowstart.lotledger.data.dto.PriceBackfillResultDto;
import org.nowstart.lotledger.data.dto.TransactionDto;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.entity.LotRecord;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.repository.LedgerTransactionRepository;
import org.nowstart.lotledger.repository.LotRecordRepository;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Supplies prices that the broker export did not carry. Rows that already have a price are never
 * overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceBackfillService {

    private static final Set<EventKind> PRICEABLE_KINDS = Arrays.stream(EventKind.values())
            .filter(EventKind::acceptsPrice)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(EventKind.class)));

    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final LotRecordRepository lotRecordRepository;
    private final LedgerRebuildService ledgerRebuildService;

    @Transactional
    public PriceBackfillResultDto backfill(PriceBackfillRequest request) {
        Map<Long, PriceBackfillEntry> accepted = new LinkedHashMap<>();
        Map<Long, LedgerTransaction> targets = new LinkedHashMap<>();
        int alreadyPriced = 0;
        int notPriceable = 0;
        int notFound = 0;

        for (PriceBackfillEntry entry : request.entries()) {
            List<LedgerTransaction> candidates = resolve(entry);
            if (candidates.isEmpty()) {
                notFound++;
                continue;
            }
            Optional<LedgerTransaction> target = candidates.stream()
                    .filter(this::isPriceable)
                    .filter(candidate -> !candidate.isPriced())
                    .findFirst();
            if (target.isPresent()) {
                targets.put(target.get().getId(), target.get());
                accepted.put(target.get().getId(), entry);
            } else if (candidates.stream().anyMatch(this::isPriceable)) {
                alreadyPriced++;
            } else {
                notPriceable++;
            }
        }

        accepted.forEach((id, entry) -> apply(targets.get(id), entry));
        if (!targets.isEmpty()) {
            ledgerTransactionRepository.saveAll(targets.values());
            ledgerRebuildService.rebuild();
        }

        log.info(
                "event=price_backfill entries={} updated={} already_priced={} not_priceable={} not_found={}",
                request.entries().size(),
                targets.size(),
                alreadyPriced,
                notPriceable,
                notFound
        );
        return new PriceBackfillResultDto(targets.size(), alreadyPriced, notPriceable, notFound);
    }

    /**
     * Rows whose cost or proceeds are still unknown. A MERGER_IN row is listed only when its cost could
     * not be carried over from the merged symbols.
     */
    @Transactional(readOnly = true)
    public List<TransactionDto> listUnpriced() {
        List<LedgerTransaction> unpriced = ledgerTransactionRepository
                .findByUnitPriceIsNullAndKindInOrderByTradeDateAscIdAsc(PRICEABLE_KINDS);

        List<Long> mergerIds = unpriced.stream()
                .filter(transaction -> transaction.getKind() == EventKind.MERGER_IN)
                .map(LedgerTransaction::getId)
                .toList();
        Set<Long> pendingMergerIds = new HashSet<>();
        if (!mergerIds.isEmpty()) {
            for (LotRecord lot : lotRecordRepository.findByLotIdInAndCostPendingTrue(mergerIds)) {
                pendingMergerIds.add(lot.getLotId());
            }
        }

        List<TransactionDto> result = new ArrayList<>();
        for (LedgerTransaction transaction : unpriced) {
            if (transaction.getKind() == EventKind.MERGER_IN && !pendingMergerIds.contains(transaction.getId())) {
                continue;
            }
            result.add(LedgerDtoMapper.toTransactionDto(transaction));
        }
        return result;
    }

    private List<LedgerTransaction> resolve(PriceBackfillEntry entry) {
        if (entry.transactionId() != null) {
            return ledgerTransactionRepository.findById(entry.transactionId())
                    .map(List::of)
                    .orElse(List.of());
        }
        return ledgerTransactionRepository.findBySymbolAndTradeDateAndQuantityOrderByIdAsc(
                entry.symbol().trim().toUpperCase(Locale.ROOT),
                entry.date(),
                entry.quantity()
        );
    }

    private boolean isPriceable(LedgerTransaction transaction) {
        return transaction.getKind().acceptsPrice();
    }

    private void apply(LedgerTransaction transaction, PriceBackfillEntry entry) {
        transaction.setUnitPrice(Money.fromMajorUnits(entry.unitPrice()).toMajorUnits());
        if (entry.fee() == null) {
            return;
        }
        if (transaction.getKind() == EventKind.SELL) {
            transaction.setFee(Money.fromMajorUnits(entry.fee()).toMajorUnits());
        } else {
            log.debug("fee ignored for {} transaction {}", transaction.getKind(), transaction.getId());
        }
    }
}
