/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を相互に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースと、NULL 列の読み出しを一箇所で扱うため
 */
package com.example.registry.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp.from で渡し、DB のタイムゾーン設定に依存しない
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
