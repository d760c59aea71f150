/*
 * どこで: Registry エクスポート
 * 何を: 全件一覧の取得に続けて、サーバーローカルへ CSV/JSON を書き出す
 * なぜ: 取得結果をバックエンド側でも確認できるようにするため (失敗しても一覧応答は返す)
 */
package com.example.registry.service;

import com.example.registry.config.RegistryExportProperties;
import com.example.registry.model.EmployeeRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmployeeAutoExporter {

  static final String MODE = "auto";

  private static final Logger logger = LoggerFactory.getLogger(EmployeeAutoExporter.class);

  private final EmployeeExportWriter exportWriter;
  private final RegistryExportProperties exportProperties;
  private final EmployeeMetrics metrics;
  private final Clock clock;

  /** Writes the enabled formats and returns the files that were written. */
  public List<Path> export(List<EmployeeRecord> records) {
    final List<Path> written = new ArrayList<>();
    if (exportProperties.autoCsv()) {
      writeFile(ExportFormat.CSV, records, written);
    }
    if (exportProperties.autoJson()) {
      writeFile(ExportFormat.JSON, records, written);
    }
    return written;
  }

  private void writeFile(ExportFormat format, List<EmployeeRecord> records, List<Path> written) {
    final String fileName = exportWriter.fileName(format, Instant.now(clock));
    try {
      final Path directory = Path.of(exportProperties.directory());
      final Path target = directory.resolve(fileName);
      Files.createDirectories(directory);
      Files.write(target, exportWriter.render(format, records));
      written.add(target);
      metrics.recordExport(format, MODE, "success");
      logger.info("employee export written format={} rows={} path={}", format, records.size(), target);
    } catch (IOException
        | UncheckedIOException
        | InvalidPathException
        | IllegalStateException ex) {
      // 自動出力は一覧取得の副作用なので、失敗は記録のみで呼び出し元へ伝播しない
      metrics.recordExport(format, MODE, "failure");
      logger.warn(
          "employee export failed format={} directory={} file={}",
          format,
          exportProperties.directory(),
          fileName,
          ex);
    }
  }
}
