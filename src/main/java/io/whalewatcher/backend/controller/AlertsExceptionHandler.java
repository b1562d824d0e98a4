package io.whalewatcher.backend.controller;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.whalewatcher.backend.controller")
public class AlertsExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(AlertsExceptionHandler.class);

  // Java parameter name -> query parameter name.
  private static final Map<String, String> QUERY_PARAMS =
      Map.of("limit", "limit", "minAmount", "min_amount");

  /** Out-of-range {@code limit} or {@code min_amount}, reported under the query parameter name. */
  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> onConstraintViolation(ConstraintViolationException e) {
    String message =
        e.getConstraintViolations().stream()
            .map(v -> parameterName(v) + " " + v.getMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    return badRequest(message.isEmpty() ? "Invalid request" : message);
  }

  @ExceptionHandler({
    HandlerMethodValidationException.class,
    BindException.class,
    WebExchangeBindException.class,
    ServerWebInputException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return badRequest(e.getMessage() == null ? "Invalid request" : e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("alerts request failed", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", "INTERNAL_ERROR",
                "message", "Internal server error",
                "timestamp", Instant.now().toEpochMilli()));
  }

  private static ResponseEntity<Map<String, Object>> badRequest(String message) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", "BAD_REQUEST",
                "message", message,
                "timestamp", Instant.now().toEpochMilli()));
  }

  private static String parameterName(ConstraintViolation<?> violation) {
    String name = null;
    for (Path.Node node : violation.getPropertyPath()) {
      name = node.getName();
    }
    if (name == null) return "request";
    return QUERY_PARAMS.getOrDefault(name, name);
  }
}
