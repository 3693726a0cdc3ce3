/*
 * Where: Dispatch API
 * What: Maps domain exceptions to HTTP responses
 * Why: Every endpoint reports errors in the same {code, message} shape
 */
package com.example.dispatch.api;

import com.example.dispatch.model.InvalidStateTransitionException;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.service.MissingPlaceholderException;
import com.example.dispatch.service.NotificationNotFoundException;
import com.example.dispatch.service.TemplateNotFoundException;
import com.example.dispatch.service.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(InvalidStateTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(
      InvalidStateTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.INVALID_STATE_TRANSITION, ex.getMessage());
  }

  @ExceptionHandler(ConcurrencyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConcurrencyConflict(
      ConcurrencyConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONCURRENCY_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotificationNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(TemplateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateNotFound(TemplateNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.TEMPLATE_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(MissingPlaceholderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingPlaceholder(
      MissingPlaceholderException ex) {
    return error(
        HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorCode.MISSING_PLACEHOLDER, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // first field message is enough for the client
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // parser internals stay out of the response
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.VALIDATION_FAILED, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
