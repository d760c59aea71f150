/*
 * どこで: Registry 画面
 * 何を: 一覧画面の 1 行分の表示用データ
 * なぜ: テンプレート側で時刻整形をせず、表示用の文字列を受け取るだけにするため
 */
package com.example.registry.web;

public record EmployeeRow(
    long id,
    String externalKey,
    String name,
    String rights,
    String status,
    String remarks,
    String timestampText) {}
