package com.example.marketdata.controller;

import com.example.marketdata.exception.AuthenticationFailedException;
import com.example.marketdata.exception.CapabilityNotSupportedException;
import com.example.marketdata.exception.MarketDataException;
import com.example.marketdata.exception.ProviderNotImplementedException;
import com.example.marketdata.exception.TransportException;
import com.example.marketdata.exception.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps market data failures to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class MarketDataExceptionHandler {

  @ExceptionHandler({CapabilityNotSupportedException.class, ProviderNotImplementedException.class})
  public ResponseEntity<Map<String, Object>> handleUnsupported(MarketDataException e) {
    log.warn("Unsupported request: {}", e.getMessage());
    return error(HttpStatus.NOT_IMPLEMENTED, "unsupported", e);
  }

  @ExceptionHandler(AuthenticationFailedException.class)
  public ResponseEntity<Map<String, Object>> handleAuthentication(AuthenticationFailedException e) {
    log.error("Provider authentication failed: {}", e.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "authentication_failed", e);
  }

  @ExceptionHandler(TransportException.class)
  public ResponseEntity<Map<String, Object>> handleTransport(TransportException e) {
    log.error("Provider transport failure: {}", e.getMessage());
    ResponseEntity<Map<String, Object>> response = error(HttpStatus.BAD_GATEWAY, "transport_failure", e);
    if (e.hasStatusCode()) {
      response.getBody().put("upstreamStatus", e.getStatusCode());
    }
    return response;
  }

  @ExceptionHandler(UnknownProviderException.class)
  public ResponseEntity<Map<String, Object>> handleUnknownProvider(UnknownProviderException e) {
    return error(HttpStatus.BAD_REQUEST, "unknown_provider", e);
  }

  @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
    log.debug("Bad request: {}", e.getMessage());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "bad_request");
    body.put("message", e.getMessage());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, Object>> handleUnavailable(IllegalStateException e) {
    log.error("Provider unavailable: {}", e.getMessage());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "unavailable");
    body.put("message", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, MarketDataException e) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", e.getMessage());
    body.put("vendor", e.getVendor());
    if (e.getOperation() != null) {
      body.put("operation", e.getOperation());
    }
    if (e.getSymbol() != null) {
      body.put("symbol", e.getSymbol());
    }
    return ResponseEntity.status(status).body(body);
  }
}
