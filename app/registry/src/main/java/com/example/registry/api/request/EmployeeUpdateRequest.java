/*
 * どこで: app/registry/src/main/java/com/example/registry/api/request/EmployeeUpdateRequest.java
 * 何を: PUT /records/{id} と POST /update/{id} の入力 DTO
 * なぜ: 指定された項目だけを更新する部分更新の契約を表すため
 */
package com.example.registry.api.request;

import com.example.registry.model.EmployeeChanges;
import jakarta.validation.constraints.Size;

public record EmployeeUpdateRequest(
        @Size(max = 50, message = "externalKey must be at most 50 characters")
        String externalKey,
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,
        @Size(max = 50, message = "rights must be at most 50 characters")
        String rights,
        @Size(max = 50, message = "status must be at most 50 characters")
        String status,
        @Size(max = 500, message = "remarks must be at most 500 characters")
        String remarks) {

    public EmployeeChanges toChanges() {
        return new EmployeeChanges(externalKey, name, rights, status, remarks);
    }
}
