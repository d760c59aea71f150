package com.example.registry.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class EmployeeMetrics {

  static final String METRIC_OPERATION_TOTAL = "registry.employee.operation.total";
  static final String METRIC_EXPORT_TOTAL = "registry.export.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> operationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> exportCounters = new ConcurrentHashMap<>();

  public EmployeeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordOperation(String operation, String result) {
    operationCounters
        .computeIfAbsent(
            operation + ":" + result,
            ignored ->
                Counter.builder(METRIC_OPERATION_TOTAL)
                    .description("Employee write outcomes")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordExport(ExportFormat format, String mode, String result) {
    final String formatTag = format.extension();
    exportCounters
        .computeIfAbsent(
            formatTag + ":" + mode + ":" + result,
            ignored ->
                Counter.builder(METRIC_EXPORT_TOTAL)
                    .description("Employee export outcomes")
                    .tags(Tags.of("format", formatTag, "mode", mode, "result", result))
                    .register(meterRegistry))
        .increment();
  }
}
