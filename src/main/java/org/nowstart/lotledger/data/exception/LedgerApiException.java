package org.nowstart.lotledger.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class LedgerApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public LedgerApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
