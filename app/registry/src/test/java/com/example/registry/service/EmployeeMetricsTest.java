package com.example.registry.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class EmployeeMetricsTest {

  @Test
  void countsOperationAndExportOutcomesPerTag() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final EmployeeMetrics metrics = new EmployeeMetrics(registry);

    metrics.recordOperation("create", "success");
    metrics.recordOperation("create", "success");
    metrics.recordOperation("create", "duplicate_key");
    metrics.recordExport(ExportFormat.JSON, "download", "success");

    assertThat(
            registry.get("registry.employee.operation.total")
                .tag("operation", "create")
                .tag("result", "success")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            registry.get("registry.employee.operation.total")
                .tag("result", "duplicate_key")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("registry.export.total")
                .tag("format", "json")
                .tag("mode", "download")
                .counter()
                .count())
        .isEqualTo(1.0);
  }
}
