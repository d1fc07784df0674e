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
public class DisposalRecord extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String symbol;

    private long transactionId;

    @Enumerated(EnumType.STRING)
    private EventKind kind;

    private LocalDate disposalDate;

    private long lotId;

    private LocalDate lotOpenedDate;

    private long quantity;

    @Column(precision = 19, scale = 2)
    private BigDecimal proceeds;

    @Column(precision = 19, scale = 2)
    private BigDecimal costBasis;

    @Column(precision = 19, scale = 2)
    private BigDecimal gain;

    private long holdingDays;

    private boolean longTerm;
}
