package com.pdfstorage.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** OAuth code 换不到 access token（code 缺失、过期或无效） */
public class AuthExchangeException extends ResponseStatusException {

    public AuthExchangeException() {
        super(HttpStatus.BAD_REQUEST, "No access token");
    }
}
