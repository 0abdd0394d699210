package com.example.storefront.exception;

import org.springframework.http.HttpStatus;

public class InvalidIdentifierException extends ApiException {

    public InvalidIdentifierException() {
        super(HttpStatus.BAD_REQUEST, "invalid_id", "Invalid id");
    }
}
