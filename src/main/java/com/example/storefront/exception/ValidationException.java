package com.example.storefront.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {

    private final String field;

    public ValidationException(String field, String message) {
        this("validation_error", field, message);
    }

    protected ValidationException(String code, String field, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
