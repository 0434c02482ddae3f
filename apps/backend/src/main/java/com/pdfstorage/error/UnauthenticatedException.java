package com.pdfstorage.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class UnauthenticatedException extends ResponseStatusException {

    public UnauthenticatedException() {
        super(HttpStatus.UNAUTHORIZED, "Not logged in");
    }
}
