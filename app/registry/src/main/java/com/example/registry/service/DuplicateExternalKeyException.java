/*
 * どこで: Registry サービス層
 * 何を: externalKey 重複を表す例外を定義する
 * なぜ: 事前チェックと DB 一意制約のどちらで検出しても同じ応答へ変換するため
 */
package com.example.registry.service;

public class DuplicateExternalKeyException extends RuntimeException {

  public DuplicateExternalKeyException(String externalKey) {
    super("employee with externalKey '" + externalKey + "' already exists");
  }
}
