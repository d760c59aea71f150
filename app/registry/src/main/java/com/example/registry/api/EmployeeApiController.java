/*
 * どこで: Registry API
 * 何を: 従業員の一覧/検索/登録/更新/削除の JSON エンドポイントを提供する
 * なぜ: 画面と同じサービス層を REST 契約からも利用できるようにするため
 */
package com.example.registry.api;

import com.example.registry.api.request.EmployeeCreateRequest;
import com.example.registry.api.request.EmployeeUpdateRequest;
import com.example.registry.api.request.SearchRequest;
import com.example.registry.api.response.EmployeeResponse;
import com.example.registry.model.EmployeeRecord;
import com.example.registry.service.EmployeeAutoExporter;
import com.example.registry.service.EmployeeService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Validated
public class EmployeeApiController {

    static final int MAX_LIMIT = 1000;

    private final EmployeeService employeeService;
    private final EmployeeAutoExporter autoExporter;

    @GetMapping("/records")
    public List<EmployeeResponse> list(
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "skip", defaultValue = "0")
            @Min(value = 0, message = "skip must be zero or greater")
            int skip,
            @RequestParam(value = "limit", defaultValue = "100")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = MAX_LIMIT, message = "limit must be at most 1000")
            int limit) {
        return toResponses(employeeService.list(search, skip, limit));
    }

    /**
     * 役割:
     * - 全件を ID 降順で返す。
     *
     * 期待動作:
     * - 自動エクスポートが有効なら、取得結果をサーバーローカルへ CSV/JSON で書き出す。
     * - 書き出しの失敗は応答に影響させない。
     */
    @GetMapping("/records/all")
    public List<EmployeeResponse> listAll() {
        final List<EmployeeRecord> records = employeeService.listAll();
        autoExporter.export(records);
        return toResponses(records);
    }

    @GetMapping("/records/{id}")
    public EmployeeResponse get(@PathVariable("id") long id) {
        return EmployeeResponse.from(employeeService.get(id));
    }

    @PostMapping("/records")
    public ResponseEntity<EmployeeResponse> create(@Valid @RequestBody EmployeeCreateRequest request) {
        final EmployeeRecord created = employeeService.create(request.toDraft());
        return ResponseEntity.created(URI.create("/records/" + created.id()))
                .body(EmployeeResponse.from(created));
    }

    /**
     * 役割:
     * - 指定された項目だけを更新する。
     *
     * 期待動作:
     * - 項目が一つもなければ 400、対象が存在しなければ 404 とする。
     * - 他の従業員が使用中の externalKey へ変更しようとした場合は 409 とする。
     */
    @PutMapping("/records/{id}")
    public EmployeeResponse update(
            @PathVariable("id") long id,
            @Valid @RequestBody EmployeeUpdateRequest request) {
        return EmployeeResponse.from(employeeService.update(id, request.toChanges()));
    }

    @DeleteMapping("/records/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        employeeService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/search")
    public List<EmployeeResponse> search(@RequestBody SearchRequest request) {
        return toResponses(employeeService.search(request.query()));
    }

    private List<EmployeeResponse> toResponses(List<EmployeeRecord> records) {
        return records.stream().map(EmployeeResponse::from).toList();
    }
}
