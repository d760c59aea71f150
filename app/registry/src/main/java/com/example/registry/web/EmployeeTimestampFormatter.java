package com.example.registry.web;

import com.example.registry.config.RegistryDisplayProperties;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

@Component
public class EmployeeTimestampFormatter {

  private final DateTimeFormatter formatter;

  public EmployeeTimestampFormatter(RegistryDisplayProperties displayProperties) {
    this.formatter =
        DateTimeFormatter.ofPattern(displayProperties.timestampPattern())
            .withZone(displayProperties.zoneId());
  }

  public String format(Instant instant) {
    return instant == null ? "" : formatter.format(instant);
  }
}
