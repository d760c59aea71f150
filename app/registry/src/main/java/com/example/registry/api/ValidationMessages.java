/*
 * どこで: Registry API/画面 共通
 * 何を: 入力検証の標準例外からクライアント向けの短いメッセージを取り出す
 * なぜ: JSON 応答とフォーム応答で同じ文言を返すため
 */
package com.example.registry.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

public final class ValidationMessages {

  private ValidationMessages() {}

  public static String of(BindingResult bindingResult) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    return bindingResult.getAllErrors().stream()
        .map(DefaultMessageSourceResolvable::getDefaultMessage)
        .filter(ValidationMessages::hasText)
        .findFirst()
        .orElse("request is invalid");
  }

  public static String of(ConstraintViolationException ex) {
    return ex.getConstraintViolations().stream()
        .map(ConstraintViolation::getMessage)
        .filter(ValidationMessages::hasText)
        .findFirst()
        .orElse("request is invalid");
  }

  public static String of(HandlerMethodValidationException ex) {
    return ex.getAllErrors().stream()
        .map(MessageSourceResolvable::getDefaultMessage)
        .filter(ValidationMessages::hasText)
        .findFirst()
        .orElse("request is invalid");
  }

  public static String of(MethodArgumentTypeMismatchException ex) {
    return ex.getName() + " is invalid";
  }

  public static String of(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return "request body is required";
    }
    return "request body is invalid";
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
