/*
 * どこで: app/registry/src/main/java/com/example/registry/api/response/EmployeeResponse.java
 * 何を: 従業員 1 件の出力 DTO
 * なぜ: クライアントに返す属性を永続化モデルから切り離して安定させるため
 */
package com.example.registry.api.response;

import com.example.registry.model.EmployeeRecord;
import java.time.Instant;

public record EmployeeResponse(
        long id,
        String externalKey,
        String name,
        String rights,
        String status,
        String remarks,
        Instant createdAt,
        Instant updatedAt) {

    public static EmployeeResponse from(EmployeeRecord record) {
        return new EmployeeResponse(
                record.id(),
                record.externalKey(),
                record.name(),
                record.rights(),
                record.status(),
                record.remarks(),
                record.createdAt(),
                record.updatedAt());
    }
}
