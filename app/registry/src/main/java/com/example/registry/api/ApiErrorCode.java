/*
 * どこで: Registry API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.registry.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    DUPLICATE_KEY,
    NOT_FOUND,
    STORE_UNAVAILABLE,
    STORE_ERROR,
    INTERNAL_ERROR
}
