package org.nowstart.lotledger.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lotledger.service.ledger.core.Money;
import org.nowstart.lotledger.service.quote.Quote;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MarketQuote extends AuditableEntity {

    @Id
    private String symbol;

    @Column(precision = 19, scale = 2)
    private BigDecimal lastPrice;

    private Instant quotedAt;

    public Quote toQuote() {
        return new Quote(symbol, Money.fromMajorUnits(lastPrice), quotedAt);
    }
}
