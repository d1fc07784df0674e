package org.nowstart.lotledger.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lotledger.data.type.EventKind;
import org.nowstart.lotledger.service.ledger.core.LedgerEvent;
import org.nowstart.lotledger.service.ledger.core.Money;

/**
 * One imported export row. The generated id doubles as the replay sequence.
 */
@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(indexes = @Index(name = "idx_ledger_transaction_symbol_date", columnList = "symbol, tradeDate"))
public class LedgerTransaction extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String symbol;

    @Column(nullable = false)
    private LocalDate tradeDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventKind kind;

    private long quantity;

    @Column(precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(precision = 19, scale = 2)
    private BigDecimal fee;

    @Column(length = 512)
    private String description;

    private LocalDate purchaseDate;

    private boolean unclassified;

    public boolean isPriced() {
        return unitPrice != null;
    }

    public LedgerEvent toEvent() {
        return new LedgerEvent(
                symbol,
                tradeDate,
                kind,
                quantity,
                unitPrice == null ? null : Money.fromMajorUnits(unitPrice),
                fee == null ? null : Money.fromMajorUnits(fee),
                id,
                description,
                purchaseDate
        );
    }
}
