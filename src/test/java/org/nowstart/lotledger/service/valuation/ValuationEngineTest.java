package org.nowstart.lotledger.service.valuation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.nowstart.lotledger.data.type.ValuationStatus;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.quote.Quote;

class ValuationEngineTest {

    private final ValuationEngine engine = new ValuationEngine();

    @Test
    void value_computesMarketValueAndUnrealizedPnl() {
        HoldingSnapshot holding = holding("NABIL", 195L, "59053.75", false);

        HoldingValuation valuation = engine.value(holding, quote("NABIL", "320.00"));

        assertThat(valuation.status()).isEqualTo(ValuationStatus.PRICED);
        assertThat(valuation.isPriced()).isTrue();
        assertThat(valuation.symbol()).isEqualTo("NABIL");
        assertThat(valuation.currentValue()).isEqualTo(Money.fromMajorUnits("62400.00"));
        assertThat(valuation.unrealizedPnl()).isEqualTo(Money.fromMajorUnits("3346.25"));
        assertThat(valuation.unrealizedPnlPercent()).isCloseTo(5.666, within(0.001));
    }

    @Test
    void value_leavesPercentEmptyWhenHoldingCostNothing() {
        HoldingSnapshot holding = holding("SCB", 10L, "0.00", false);

        HoldingValuation valuation = engine.value(holding, quote("SCB", "100.00"));

        assertThat(valuation.status()).isEqualTo(ValuationStatus.PRICED);
        assertThat(valuation.unrealizedPnl()).isEqualTo(Money.fromMajorUnits("1000.00"));
        assertThat(valuation.unrealizedPnlPercent()).isNull();
    }

    @Test
    void value_withoutQuoteLeavesMarketFieldsEmpty() {
        HoldingSnapshot holding = holding("API", 50L, "6050.00", false);

        HoldingValuation valuation = engine.value(holding, null);

        assertThat(valuation.status()).isEqualTo(ValuationStatus.PRICE_UNAVAILABLE);
        assertThat(valuation.quote()).isNull();
        assertThat(valuation.currentValue()).isNull();
        assertThat(valuation.unrealizedPnl()).isNull();
        assertThat(valuation.unrealizedPnlPercent()).isNull();
        assertThat(valuation.holding().totalCost()).isEqualTo(Money.fromMajorUnits("6050.00"));
    }

    @Test
    void value_costPendingHoldingHasValueButNoPnl() {
        HoldingSnapshot holding = holding("KBL", 100L, "0.00", true);

        HoldingValuation valuation = engine.value(holding, quote("KBL", "210.50"));

        assertThat(valuation.status()).isEqualTo(ValuationStatus.COST_PENDING);
        assertThat(valuation.isPriced()).isFalse();
        assertThat(valuation.currentValue()).isEqualTo(Money.fromMajorUnits("21050.00"));
        assertThat(valuation.unrealizedPnl()).isNull();
        assertThat(valuation.unrealizedPnlPercent()).isNull();
    }

    private static HoldingSnapshot holding(String symbol, long quantity, String totalCost, boolean costPending) {
        Money cost = Money.fromMajorUnits(totalCost);
        Money average = quantity == 0L ? Money.zero() : cost.divide(quantity);
        return new HoldingSnapshot(symbol, quantity, cost, average, Money.zero(), costPending);
    }

    private static Quote quote(String symbol, String price) {
        return new Quote(symbol, Money.fromMajorUnits(price), Instant.parse("2025-06-22T09:00:00Z"));
    }
}
