package org.nowstart.diversion.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class DiversionException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public DiversionException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
