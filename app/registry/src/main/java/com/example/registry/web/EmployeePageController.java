/*
 * どこで: Registry 画面
 * 何を: 一覧画面の描画と、フォーム送信による登録/更新/削除を受け付ける
 * なぜ: ブラウザのフォームだけで CRUD を完結させるため (成功時は 303 で一覧へ戻す)
 */
package com.example.registry.web;

import com.example.registry.api.request.EmployeeCreateRequest;
import com.example.registry.api.request.EmployeeUpdateRequest;
import com.example.registry.model.EmployeeRecord;
import com.example.registry.service.EmployeeService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
@RequiredArgsConstructor
@Validated
public class EmployeePageController {

  static final String VIEW_INDEX = "index";
  private static final URI LIST_PAGE = URI.create("/");

  private final EmployeeService employeeService;
  private final EmployeeTimestampFormatter timestampFormatter;

  @GetMapping({"/", "/main"})
  public String index(
      @RequestParam(value = "search", required = false) String search,
      @RequestParam(value = "skip", defaultValue = "0")
          @Min(value = 0, message = "skip must be zero or greater")
          int skip,
      @RequestParam(value = "limit", defaultValue = "100")
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 1000, message = "limit must be at most 1000")
          int limit,
      Model model) {
    final List<EmployeeRow> rows =
        employeeService.list(search, skip, limit).stream().map(this::toRow).toList();
    model.addAttribute("employees", rows);
    model.addAttribute("searchTerm", search == null ? "" : search);
    model.addAttribute("skip", skip);
    model.addAttribute("limit", limit);
    return VIEW_INDEX;
  }

  @PostMapping("/add")
  public ResponseEntity<Void> add(@Valid @ModelAttribute EmployeeCreateRequest form) {
    employeeService.create(form.toDraft());
    return redirectToList();
  }

  @PostMapping("/update/{id}")
  public ResponseEntity<Void> update(
      @PathVariable("id") long id, @Valid @ModelAttribute EmployeeUpdateRequest form) {
    employeeService.update(id, form.toChanges());
    return redirectToList();
  }

  @PostMapping("/delete/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") long id) {
    employeeService.delete(id);
    return redirectToList();
  }

  private ResponseEntity<Void> redirectToList() {
    return ResponseEntity.status(HttpStatus.SEE_OTHER).location(LIST_PAGE).build();
  }

  private EmployeeRow toRow(EmployeeRecord record) {
    return new EmployeeRow(
        record.id(),
        record.externalKey(),
        record.name(),
        record.rights(),
        record.status(),
        record.remarks(),
        timestampFormatter.format(record.updatedAt()));
  }
}
