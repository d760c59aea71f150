package com.example.registry.api.request;

public record SearchRequest(String query) {}
