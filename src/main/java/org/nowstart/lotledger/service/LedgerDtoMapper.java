package org.nowstart.lotledger.service;

import java.math.BigDecimal;
import org.nowstart.lotledger.data.dto.DisposalDto;
import org.nowstart.lotledger.data.dto.HoldingDto;
import org.nowstart.lotledger.data.dto.LotDto;
import org.nowstart.lotledger.data.dto.TransactionDto;
import org.nowstart.lotledger.data.entity.DisposalRecord;
import org.nowstart.lotledger.data.entity.HoldingRecord;
import org.nowstart.lotledger.data.entity.LedgerTransaction;
import org.nowstart.lotledger.data.entity.LotRecord;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Lot;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.ledger.core.RealizedDisposal;
import org.nowstart.lotledger.service.valuation.HoldingValuation;

final class LedgerDtoMapper {

    private LedgerDtoMapper() {
    }

    static TransactionDto toTransactionDto(LedgerTransaction transaction) {
        return new TransactionDto(
                transaction.getId(),
                transaction.getSymbol(),
                transaction.getTradeDate(),
                transaction.getKind(),
                transaction.getQuantity(),
                transaction.getUnitPrice(),
                transaction.getFee(),
                transaction.getDescription(),
                transaction.getPurchaseDate(),
                transaction.isUnclassified()
        );
    }

    static LotDto toLotDto(LotRecord lot) {
        return new LotDto(
                lot.getLotId(),
                lot.getSymbol(),
                lot.getSourceKind(),
                lot.getOpenedDate(),
                lot.getOpenedQuantity(),
                lot.getRemainingQuantity(),
                lot.getUnitCost(),
                lot.isCostPending()
        );
    }

    static DisposalDto toDisposalDto(DisposalRecord disposal) {
        return new DisposalDto(
                disposal.getTransactionId(),
                disposal.getSymbol(),
                disposal.getKind(),
                disposal.getDisposalDate(),
                disposal.getLotId(),
                disposal.getLotOpenedDate(),
                disposal.getQuantity(),
                disposal.getProceeds(),
                disposal.getCostBasis(),
                disposal.getGain(),
                disposal.getHoldingDays(),
                disposal.isLongTerm()
        );
    }

    static HoldingDto toHoldingDto(HoldingRecord holding) {
        return new HoldingDto(
                holding.getSymbol(),
                holding.getTotalQuantity(),
                holding.getTotalCost(),
                holding.getAverageCost(),
                holding.getRealizedPnl(),
                holding.isCostPending(),
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    static HoldingDto toHoldingDto(HoldingValuation valuation) {
        HoldingSnapshot holding = valuation.holding();
        return new HoldingDto(
                holding.symbol(),
                holding.totalQuantity(),
                major(holding.totalCost()),
                major(holding.averageCost()),
                major(holding.realizedPnl()),
                holding.costPending(),
                valuation.quote() == null ? null : major(valuation.quote().lastPrice()),
                valuation.quote() == null ? null : valuation.quote().asOf(),
                major(valuation.currentValue()),
                major(valuation.unrealizedPnl()),
                valuation.unrealizedPnlPercent(),
                valuation.status()
        );
    }

    static LotRecord toLotRecord(Lot lot) {
        return LotRecord.builder()
                .symbol(lot.getSymbol())
                .lotId(lot.getLotId())
                .sourceKind(lot.getSourceKind())
                .openedDate(lot.getOpenedDate())
                .openedQuantity(lot.getOpenedQuantity())
                .remainingQuantity(lot.getRemainingQuantity())
                .unitCost(lot.getUnitCost().toMajorUnits())
                .costPending(lot.isCostPending())
                .build();
    }

    static DisposalRecord toDisposalRecord(RealizedDisposal disposal) {
        return DisposalRecord.builder()
                .symbol(disposal.symbol())
                .transactionId(disposal.eventSequence())
                .kind(disposal.kind())
                .disposalDate(disposal.disposalDate())
                .lotId(disposal.lotId())
                .lotOpenedDate(disposal.lotOpenedDate())
                .quantity(disposal.quantity())
                .proceeds(major(disposal.proceeds()))
                .costBasis(major(disposal.costBasis()))
                .gain(major(disposal.gain()))
                .holdingDays(disposal.holdingDays())
                .longTerm(disposal.longTerm())
                .build();
    }

    static HoldingRecord toHoldingRecord(HoldingSnapshot holding) {
        return HoldingRecord.builder()
                .symbol(holding.symbol())
                .totalQuantity(holding.totalQuantity())
                .totalCost(holding.totalCost().toMajorUnits())
                .averageCost(holding.averageCost().toMajorUnits())
                .realizedPnl(holding.realizedPnl().toMajorUnits())
                .costPending(holding.costPending())
                .build();
    }

    static BigDecimal major(Money money) {
        return money == null ? null : money.toMajorUnits();
    }
}
