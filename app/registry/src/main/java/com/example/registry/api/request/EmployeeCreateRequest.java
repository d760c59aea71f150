/*
 * どこで: app/registry/src/main/java/com/example/registry/api/request/EmployeeCreateRequest.java
 * 何を: POST /records と POST /add の入力 DTO
 * なぜ: JSON とフォームの両方から同じ検証ルールで登録内容を受け取るため
 */
package com.example.registry.api.request;

import com.example.registry.model.EmployeeDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EmployeeCreateRequest(
        @NotBlank(message = "externalKey is required")
        @Size(max = 50, message = "externalKey must be at most 50 characters")
        String externalKey,
        @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,
        @Size(max = 50, message = "rights must be at most 50 characters")
        String rights,
        @Size(max = 50, message = "status must be at most 50 characters")
        String status,
        @Size(max = 500, message = "remarks must be at most 500 characters")
        String remarks) {

    public EmployeeDraft toDraft() {
        return new EmployeeDraft(externalKey, name, rights, status, remarks);
    }
}
