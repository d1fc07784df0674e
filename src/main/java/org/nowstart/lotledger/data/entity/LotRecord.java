package org.nowstart.lotledger.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lotledger.data.type.EventKind;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LotRecord extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String symbol;

    // id of the transaction that opened the lot
    private long lotId;

    @Enumerated(EnumType.STRING)
    private EventKind sourceKind;

    private LocalDate openedDate;

    private long openedQuantity;

    private long remainingQuantity;

    @Column(precision = 19, scale = 2)
    private BigDecimal unitCost;

    private boolean costPending;
}
