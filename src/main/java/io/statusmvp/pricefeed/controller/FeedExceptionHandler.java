package io.statusmvp.pricefeed.controller;

import io.statusmvp.pricefeed.error.FeedException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.statusmvp.pricefeed.controller")
public class FeedExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(FeedExceptionHandler.class);

  @ExceptionHandler(FeedException.class)
  public ResponseEntity<Map<String, Object>> onFeedError(FeedException e) {
    if (e.getHttpStatus() >= 500) {
      log.warn("feed request failed: {} {}", e.getCode(), e.getMessage());
    }
    Map<String, Object> body =
        Map.of(
            "ok", false,
            "code", e.getCode().name(),
            "message", e.getMessage() == null ? e.getCode().name() : e.getMessage(),
            "details", e.getDetails(),
            "timestamp", Instant.now().toEpochMilli());
    return ResponseEntity.status(e.getHttpStatus()).body(body);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    BindException.class,
    WebExchangeBindException.class,
    ServerWebInputException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", "BAD_REQUEST",
                "message", e.getMessage() == null ? "Invalid request" : e.getMessage(),
                "timestamp", Instant.now().toEpochMilli()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("feed internal error", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", "INTERNAL_ERROR",
                "message", "Internal server error",
                "timestamp", Instant.now().toEpochMilli()));
  }
}
