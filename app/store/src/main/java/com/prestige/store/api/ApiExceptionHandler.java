/*
 * どこで: Store API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 全コントローラで同じ形のエラー応答を返すため
 */
package com.prestige.store.api;

import com.prestige.store.data.StorageException;
import com.prestige.store.notification.whatsapp.AggregateSendException;
import com.prestige.store.notification.whatsapp.SendException;
import com.prestige.store.service.ConflictException;
import com.prestige.store.service.ForbiddenOperationException;
import com.prestige.store.service.InvalidCredentialsException;
import com.prestige.store.service.ResourceNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
      InvalidCredentialsException ex) {
    return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, ex.getMessage());
  }

  @ExceptionHandler(ForbiddenOperationException.class)
  public ResponseEntity<ApiErrorResponse> handleForbidden(ForbiddenOperationException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.FORBIDDEN, ex.getMessage());
  }

  @ExceptionHandler(AggregateSendException.class)
  public ResponseEntity<ApiErrorResponse> handleSendExhausted(AggregateSendException ex) {
    logger.warn("whatsapp send exhausted attempts={} message={}", ex.attempts(), ex.getMessage());
    return error(HttpStatus.BAD_GATEWAY, ApiErrorCode.NOTIFICATION_SEND_FAILED, ex.getMessage());
  }

  @ExceptionHandler(SendException.class)
  public ResponseEntity<ApiErrorResponse> handleSend(SendException ex) {
    logger.warn("whatsapp send failed provider={} reason={}", ex.provider(), ex.reason(), ex);
    return error(HttpStatus.BAD_GATEWAY, ApiErrorCode.NOTIFICATION_SEND_FAILED, ex.getMessage());
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiErrorResponse> handleStorage(StorageException ex) {
    // ストア内部の文言はログにだけ残す
    logger.error("storage operation failed table={} operation={}", ex.table(), ex.operation(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.STORAGE_ERROR, "storage operation failed");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
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

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
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

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は返さない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
