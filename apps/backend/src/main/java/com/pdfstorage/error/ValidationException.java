package com.pdfstorage.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** 入参校验失败，总是在任何远端调用之前抛出 */
public class ValidationException extends ResponseStatusException {

    public ValidationException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
