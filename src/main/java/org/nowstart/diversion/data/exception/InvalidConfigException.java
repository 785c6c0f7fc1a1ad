package org.nowstart.diversion.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidConfigException extends DiversionException {

    public InvalidConfigException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_config", message);
    }
}
