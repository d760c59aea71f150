/*
 * どこで: app/registry/src/main/java/com/example/registry/model/EmployeeRecord.java
 * 何を: employees テーブル相当のドメインレコード
 * なぜ: API/Service/Repository 間で行データを型付きで受け渡すため
 */
package com.example.registry.model;

import java.time.Instant;

public record EmployeeRecord(
        long id,
        String externalKey,
        String name,
        String rights,
        String status,
        String remarks,
        Instant createdAt,
        Instant updatedAt) {
}
