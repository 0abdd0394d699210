package com.example.storefront.controller;

public record DeleteResponse(boolean success) {

    static final DeleteResponse SUCCESS = new DeleteResponse(true);
}
