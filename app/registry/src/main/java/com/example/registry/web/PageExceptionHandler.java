/*
 * どこで: Registry 画面
 * 何を: フォーム送信の失敗を人が読めるテキスト応答へ変換する
 * なぜ: ブラウザにそのまま表示できる形で、重複や未存在の理由を返すため
 */
package com.example.registry.web;

import com.example.registry.api.ValidationMessages;
import com.example.registry.service.DuplicateExternalKeyException;
import com.example.registry.service.EmployeeNotFoundException;
import com.example.registry.service.InvalidEmployeeRequestException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice(assignableTypes = EmployeePageController.class)
public class PageExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(PageExceptionHandler.class);

  @ExceptionHandler(DuplicateExternalKeyException.class)
  public ResponseEntity<String> handleDuplicateKey(DuplicateExternalKeyException ex) {
    return text(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(EmployeeNotFoundException.class)
  public ResponseEntity<String> handleNotFound(EmployeeNotFoundException ex) {
    return text(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(InvalidEmployeeRequestException.class)
  public ResponseEntity<String> handleInvalidRequest(InvalidEmployeeRequestException ex) {
    return text(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  // @ModelAttribute の検証失敗 (MethodArgumentNotValidException も BindException の派生)
  @ExceptionHandler(BindException.class)
  public ResponseEntity<String> handleBind(BindException ex) {
    return text(HttpStatus.BAD_REQUEST, ValidationMessages.of(ex.getBindingResult()));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<String> handleConstraintViolation(ConstraintViolationException ex) {
    return text(HttpStatus.BAD_REQUEST, ValidationMessages.of(ex));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<String> handleMethodValidation(HandlerMethodValidationException ex) {
    return text(HttpStatus.BAD_REQUEST, ValidationMessages.of(ex));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return text(HttpStatus.BAD_REQUEST, ValidationMessages.of(ex));
  }

  @ExceptionHandler(DataAccessResourceFailureException.class)
  public ResponseEntity<String> handleStoreUnavailable(DataAccessResourceFailureException ex) {
    logger.error("database unavailable", ex);
    return text(HttpStatus.INTERNAL_SERVER_ERROR, "Database unavailable.");
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<String> handleStoreError(DataAccessException ex) {
    logger.error("database error", ex);
    return text(HttpStatus.INTERNAL_SERVER_ERROR, "Database error.");
  }

  private ResponseEntity<String> text(HttpStatus status, String message) {
    return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(message);
  }
}
