/*
 * どこで: Registry API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一し、5xx だけをログへ残すため
 */
package com.example.registry.api;

import com.example.registry.service.DuplicateExternalKeyException;
import com.example.registry.service.EmployeeNotFoundException;
import com.example.registry.service.InvalidEmployeeRequestException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice(assignableTypes = {EmployeeApiController.class, EmployeeExportController.class})
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DuplicateExternalKeyException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateKey(DuplicateExternalKeyException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.DUPLICATE_KEY, ex.getMessage()));
  }

  @ExceptionHandler(EmployeeNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(EmployeeNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(InvalidEmployeeRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidEmployeeRequestException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    return badRequest(ValidationMessages.of(ex.getBindingResult()));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    return badRequest(ValidationMessages.of(ex));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodValidation(
      HandlerMethodValidationException ex) {
    return badRequest(ValidationMessages.of(ex));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ValidationMessages.of(ex));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return badRequest(ValidationMessages.of(ex));
  }

  @ExceptionHandler(DataAccessResourceFailureException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(
      DataAccessResourceFailureException ex) {
    logger.error("database unavailable", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, "database unavailable"));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreError(DataAccessException ex) {
    logger.error("database error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_ERROR, "database error"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }
}
