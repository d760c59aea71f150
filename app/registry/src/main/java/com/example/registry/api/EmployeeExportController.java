package com.example.registry.api;

import com.example.registry.service.EmployeeExport;
import com.example.registry.service.EmployeeService;
import com.example.registry.service.ExportFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Streams the full employee table as a download; nothing is written to local disk. */
@RestController
@RequestMapping("/export")
@RequiredArgsConstructor
public class EmployeeExportController {

  private final EmployeeService employeeService;

  @GetMapping("/csv")
  public ResponseEntity<byte[]> exportCsv() {
    return attachment(employeeService.exportAll(ExportFormat.CSV));
  }

  @GetMapping("/json")
  public ResponseEntity<byte[]> exportJson() {
    return attachment(employeeService.exportAll(ExportFormat.JSON));
  }

  private ResponseEntity<byte[]> attachment(EmployeeExport export) {
    final ContentDisposition disposition =
        ContentDisposition.attachment().filename(export.fileName()).build();
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .contentType(MediaType.parseMediaType(export.contentType()))
        .body(export.content());
  }
}
