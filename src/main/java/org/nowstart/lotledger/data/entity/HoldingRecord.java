package org.nowstart.lotledger.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lotledger.service.ledger.core.HoldingSnapshot;
import org.nowstart.lotledger.service.ledger.core.Money;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HoldingRecord extends AuditableEntity {

    @Id
    private String symbol;

    private long totalQuantity;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(precision = 19, scale = 2)
    private BigDecimal averageCost;

    @Column(precision = 19, scale = 2)
    private BigDecimal realizedPnl;

    private boolean costPending;

    public HoldingSnapshot toSnapshot() {
        return new HoldingSnapshot(
                symbol,
                totalQuantity,
                Money.fromMajorUnits(totalCost),
                Money.fromMajorUnits(averageCost),
                Money.fromMajorUnits(realizedPnl),
                costPending
        );
    }
}
