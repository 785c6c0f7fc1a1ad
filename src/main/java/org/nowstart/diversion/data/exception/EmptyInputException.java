package org.nowstart.diversion.data.exception;

import org.springframework.http.HttpStatus;

public class EmptyInputException extends DiversionException {

    public EmptyInputException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "empty_input", message);
    }
}
