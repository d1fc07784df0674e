package org.nowstart.lotledger.service.ledger.classifier;

import java.util.List;

public record ClassificationResult(
        List<ClassifiedRow> rows,
        List<RowError> errors
) {

    public ClassificationResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
