/*
 * どこで: Registry アプリの設定バインド
 * 何を: 一覧取得時の自動エクスポート(CSV/JSON)の有効/無効と出力先を保持する
 * なぜ: デバッグ用途のファイル出力を運用環境では止められるようにするため
 */
package com.example.registry.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "registry.export")
@Validated
public record RegistryExportProperties(boolean autoCsv, boolean autoJson, @NotBlank String directory) {}
