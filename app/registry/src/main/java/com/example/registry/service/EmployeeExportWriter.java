/*
 * どこで: Registry エクスポート
 * 何を: 従業員一覧を CSV/JSON のバイト列とファイル名へ変換する
 * なぜ: ダウンロードと自動ファイル出力で同じ書式を共有するため
 */
package com.example.registry.service;

import com.example.registry.config.RegistryDisplayProperties;
import com.example.registry.model.EmployeeRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

@Component
public class EmployeeExportWriter {

  static final String[] CSV_HEADER = {
    "ID", "External Key", "Name", "Rights", "Status", "Remarks", "Timestamp"
  };

  private static final String FILE_PREFIX = "employees_export_";

  private final ObjectMapper objectMapper;
  private final DateTimeFormatter fileStampFormatter;

  public EmployeeExportWriter(ObjectMapper objectMapper, RegistryDisplayProperties displayProperties) {
    this.objectMapper = objectMapper;
    this.fileStampFormatter =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(displayProperties.zoneId());
  }

  public byte[] render(ExportFormat format, List<EmployeeRecord> records) {
    return switch (format) {
      case CSV -> renderCsv(records).getBytes(StandardCharsets.UTF_8);
      case JSON -> renderJson(records);
    };
  }

  public String fileName(ExportFormat format, Instant at) {
    return FILE_PREFIX + fileStampFormatter.format(at) + "." + format.extension();
  }

  private String renderCsv(List<EmployeeRecord> records) {
    final CSVFormat csvFormat = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
    final StringWriter out = new StringWriter();
    try (CSVPrinter printer = new CSVPrinter(out, csvFormat)) {
      for (EmployeeRecord record : records) {
        printer.printRecord(
            record.id(),
            record.externalKey(),
            record.name(),
            Objects.toString(record.rights(), ""),
            Objects.toString(record.status(), ""),
            Objects.toString(record.remarks(), ""),
            Objects.toString(record.updatedAt(), ""));
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to render csv export", ex);
    }
    return out.toString();
  }

  private byte[] renderJson(List<EmployeeRecord> records) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to render json export", ex);
    }
  }
}
