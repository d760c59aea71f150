/*
 * どこで: Registry サービス層
 * 何を: externalKey の一意性確認、部分更新の項目選択、エクスポートの組み立てを担う
 * なぜ: DB 制約だけでは表現できない業務ルールを型付き例外としてハンドラへ渡すため
 */
package com.example.registry.service;

import com.example.registry.model.EmployeeChanges;
import com.example.registry.model.EmployeeDraft;
import com.example.registry.model.EmployeeField;
import com.example.registry.model.EmployeeRecord;
import com.example.registry.repository.EmployeeRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class EmployeeService {

  private static final String OPERATION_CREATE = "create";
  private static final String OPERATION_UPDATE = "update";
  private static final String OPERATION_DELETE = "delete";
  private static final String RESULT_SUCCESS = "success";
  private static final String RESULT_DUPLICATE_KEY = "duplicate_key";
  private static final String RESULT_NOT_FOUND = "not_found";
  private static final String RESULT_INVALID = "invalid";

  private final EmployeeRepository employeeRepository;
  private final EmployeeExportWriter exportWriter;
  private final EmployeeMetrics metrics;
  private final Clock clock;

  public List<EmployeeRecord> list(String search, int skip, int limit) {
    return employeeRepository.findPage(normalizeFilter(search), skip, limit);
  }

  public List<EmployeeRecord> listAll() {
    return employeeRepository.findAll(null);
  }

  /** Blank or missing text returns every employee. */
  public List<EmployeeRecord> search(String query) {
    return employeeRepository.findAll(normalizeFilter(query));
  }

  public EmployeeRecord get(long id) {
    return employeeRepository.findById(id).orElseThrow(() -> new EmployeeNotFoundException(id));
  }

  public EmployeeRecord create(@NonNull EmployeeDraft draft) {
    if (employeeRepository.findByExternalKey(draft.externalKey(), null).isPresent()) {
      metrics.recordOperation(OPERATION_CREATE, RESULT_DUPLICATE_KEY);
      throw new DuplicateExternalKeyException(draft.externalKey());
    }
    final long id;
    try {
      id = employeeRepository.insert(draft, Instant.now(clock));
    } catch (DuplicateKeyException ex) {
      // 事前チェックと INSERT の間に同じキーが登録された場合は一意制約で検出される
      metrics.recordOperation(OPERATION_CREATE, RESULT_DUPLICATE_KEY);
      throw new DuplicateExternalKeyException(draft.externalKey());
    }
    metrics.recordOperation(OPERATION_CREATE, RESULT_SUCCESS);
    return get(id);
  }

  public EmployeeRecord update(long id, @NonNull EmployeeChanges changes) {
    final Map<EmployeeField, String> fields = changes.presentFields();
    if (fields.isEmpty()) {
      metrics.recordOperation(OPERATION_UPDATE, RESULT_INVALID);
      throw new InvalidEmployeeRequestException("no fields provided for update");
    }
    final Optional<String> newKey = changes.newExternalKey();
    if (newKey.isPresent()
        && employeeRepository.findByExternalKey(newKey.get(), id).isPresent()) {
      metrics.recordOperation(OPERATION_UPDATE, RESULT_DUPLICATE_KEY);
      throw new DuplicateExternalKeyException(newKey.get());
    }
    final int updated;
    try {
      updated = employeeRepository.update(id, fields, Instant.now(clock));
    } catch (DuplicateKeyException ex) {
      metrics.recordOperation(OPERATION_UPDATE, RESULT_DUPLICATE_KEY);
      throw new DuplicateExternalKeyException(newKey.orElse(""));
    }
    if (updated == 0) {
      metrics.recordOperation(OPERATION_UPDATE, RESULT_NOT_FOUND);
      throw new EmployeeNotFoundException(id);
    }
    metrics.recordOperation(OPERATION_UPDATE, RESULT_SUCCESS);
    return get(id);
  }

  public void delete(long id) {
    if (employeeRepository.delete(id) == 0) {
      metrics.recordOperation(OPERATION_DELETE, RESULT_NOT_FOUND);
      throw new EmployeeNotFoundException(id);
    }
    metrics.recordOperation(OPERATION_DELETE, RESULT_SUCCESS);
  }

  public EmployeeExport exportAll(@NonNull ExportFormat format) {
    final List<EmployeeRecord> records = listAll();
    final EmployeeExport export =
        new EmployeeExport(
            exportWriter.fileName(format, Instant.now(clock)),
            format.contentType(),
            exportWriter.render(format, records));
    metrics.recordExport(format, "download", RESULT_SUCCESS);
    return export;
  }

  private String normalizeFilter(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    return text.trim();
  }
}
