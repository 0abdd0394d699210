package com.example.storefront.exception;

public class EmptyUpdateException extends ValidationException {

    public EmptyUpdateException() {
        super("empty_update", null, "No fields to update");
    }
}
