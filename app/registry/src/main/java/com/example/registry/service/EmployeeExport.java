/*
 * どこで: Registry サービス層
 * 何を: オンデマンドエクスポートの結果(ファイル名/Content-Type/本文)を保持する
 * なぜ: ダウンロード応答の組み立てをコントローラーへ委ねつつ、中身の生成はサービスに閉じるため
 */
package com.example.registry.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "エクスポート本文は生成直後に一度だけ書き出すためコピーしない")
public record EmployeeExport(String fileName, String contentType, byte[] content) {}
