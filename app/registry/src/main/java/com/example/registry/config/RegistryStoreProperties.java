/*
 * どこで: Registry アプリの設定バインド
 * 何を: 起動時のスキーマ初期化で使う接続リトライ回数と間隔を保持する
 * なぜ: DB の起動待ち時間を環境ごとに調整し、不正値を起動時に検出するため
 */
package com.example.registry.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "registry.store")
@Validated
public record RegistryStoreProperties(
    @NotNull @Positive Integer initMaxAttempts, @NotNull Duration initRetryDelay) {

  @AssertTrue(message = "registry.store.init-retry-delay must not be negative")
  public boolean isInitRetryDelayNonNegative() {
    // null は @NotNull で検出する前提。
    return initRetryDelay == null || !initRetryDelay.isNegative();
  }
}
