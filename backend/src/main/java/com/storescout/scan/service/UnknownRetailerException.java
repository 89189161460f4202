package com.storescout.scan.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownRetailerException extends RuntimeException {
    private final String retailer;

    public UnknownRetailerException(String retailer) {
        super("No configuration for retailer '" + retailer + "'");
        this.retailer = retailer;
    }

    public String getRetailer() {
        return retailer;
    }
}
