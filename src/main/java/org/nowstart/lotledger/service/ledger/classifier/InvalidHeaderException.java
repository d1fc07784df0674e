package org.nowstart.lotledger.service.ledger.classifier;

import java.util.List;
import lombok.Getter;

/**
 * The export header lacks a column every row needs. Fails the whole file, unlike {@link RowParseException}.
 */
@Getter
public class InvalidHeaderException extends RuntimeException {

    private final List<String> missingColumns;

    public InvalidHeaderException(List<String> missingColumns) {
        super("export header is missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }
}
