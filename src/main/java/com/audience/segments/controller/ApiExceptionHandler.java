package com.audience.segments.controller;

import com.audience.segments.model.ErrorResponse;
import com.audience.segments.ruleengine.condition.ConditionValidationException;
import com.audience.segments.ruleengine.dependency.DependencyCycleException;
import com.audience.segments.service.RuleConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ConditionValidationException.class)
  public ResponseEntity<ErrorResponse> invalidCondition(ConditionValidationException e) {
    log.debug("Rejected condition tree: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, "INVALID_CONDITION", e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalidRequest(MethodArgumentNotValidException e) {
    String message = e.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getField)
        .distinct()
        .map(field -> field + " is invalid")
        .reduce((a, b) -> a + "; " + b)
        .orElse("request is invalid");
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
  }

  @ExceptionHandler(DependencyCycleException.class)
  public ResponseEntity<ErrorResponse> cycle(DependencyCycleException e) {
    log.warn("Rejected rule change: {}", e.getMessage());
    return error(HttpStatus.CONFLICT, "DEPENDENCY_CYCLE", e.getMessage());
  }

  @ExceptionHandler(RuleConflictException.class)
  public ResponseEntity<ErrorResponse> conflict(RuleConflictException e) {
    return error(HttpStatus.CONFLICT, "RULE_CONFLICT", e.getMessage());
  }

  private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(code, message));
  }
}
