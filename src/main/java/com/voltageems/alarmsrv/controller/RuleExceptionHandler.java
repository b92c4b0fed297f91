package com.voltageems.alarmsrv.controller;

import com.voltageems.alarmsrv.exception.DuplicateRuleException;
import com.voltageems.alarmsrv.exception.RuleConstraintException;
import com.voltageems.alarmsrv.exception.RuleNotFoundException;
import com.voltageems.alarmsrv.exception.RuleValidationException;
import com.voltageems.alarmsrv.exception.StorageUnavailableException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class RuleExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(RuleExceptionHandler.class);

  @ExceptionHandler(RuleValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(RuleValidationException ex) {
    log.warn("Invalid alarm rule input: {}", ex.getMessage());
    Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Invalid rule", ex.getMessage());
    body.put("field", ex.getField());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler({
      ConstraintViolationException.class,
      HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class,
      HttpMessageNotReadableException.class
  })
  public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
    log.warn("Malformed alarm rule request: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(body(HttpStatus.BAD_REQUEST, "Malformed request", ex.getMessage()));
  }

  @ExceptionHandler(RuleNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(RuleNotFoundException ex) {
    log.warn("{}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(body(HttpStatus.NOT_FOUND, "Rule not found", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateRuleException.class)
  public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateRuleException ex) {
    Map<String, Object> body = body(HttpStatus.CONFLICT, "Duplicate rule", ex.getMessage());
    body.put("channelId", ex.getTuple().channelId());
    body.put("dataType", ex.getTuple().dataType().code());
    body.put("pointId", ex.getTuple().pointId());
    body.put("ruleName", ex.getTuple().ruleName());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(RuleConstraintException.class)
  public ResponseEntity<Map<String, Object>> handleConstraint(RuleConstraintException ex) {
    log.warn("Alarm rule rejected by store ({}): {}", ex.getKind(), ex.getMessage());
    Map<String, Object> body =
        body(HttpStatus.UNPROCESSABLE_ENTITY, "Constraint violation", ex.getMessage());
    body.put("constraint", ex.getKind().name());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException ex) {
    log.error("Rule store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(body(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      // Spring MVC's own exceptions already carry the right status.
      HttpStatusCode status = errorResponse.getStatusCode();
      HttpStatus known = HttpStatus.resolve(status.value());
      String error = known != null ? known.getReasonPhrase() : "HTTP " + status.value();
      return ResponseEntity.status(status).body(body(status, error, ex.getMessage()));
    }
    log.error("Unexpected error while handling alarm rule request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error",
            "An unexpected error occurred"));
  }

  private static Map<String, Object> body(HttpStatusCode status, String error, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    return body;
  }
}
