package com.example.registry.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Zone and pattern used for human-readable timestamps and export file names. */
@ConfigurationProperties(prefix = "registry.display")
@Validated
public record RegistryDisplayProperties(@NotNull ZoneId zoneId, @NotBlank String timestampPattern) {}
