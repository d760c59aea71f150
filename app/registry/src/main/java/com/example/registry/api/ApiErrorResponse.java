package com.example.registry.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
