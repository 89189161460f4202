package com.storescout.scan.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ScanConfigurationException extends RuntimeException {
    public ScanConfigurationException(String message) {
        super(message);
    }

    public ScanConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
