package com.storescout.scan.api;

import com.storescout.scan.service.ScanConfigurationException;
import com.storescout.scan.service.UnknownRetailerException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScanExceptionHandler {

  @ExceptionHandler(UnknownRetailerException.class)
  public ResponseEntity<Map<String, String>> handleUnknownRetailer(UnknownRetailerException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of(
            "error", "unknown_retailer",
            "retailer", String.valueOf(ex.getRetailer()),
            "message", ex.getMessage()));
  }

  @ExceptionHandler(ScanConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleBadConfiguration(ScanConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_scan_configuration", "message", ex.getMessage()));
  }
}
