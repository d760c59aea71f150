/*
 * どこで: Registry API のWeb層テスト
 * 何を: ステータスコードとエラー応答 (ApiErrorResponse) の契約を検証する
 * なぜ: 201/200/204 と 400/404/409 の振り分けをクライアントが前提にできるようにするため
 */
package com.example.registry.api;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.registry.model.EmployeeChanges;
import com.example.registry.model.EmployeeDraft;
import com.example.registry.model.EmployeeRecord;
import com.example.registry.service.DuplicateExternalKeyException;
import com.example.registry.service.EmployeeAutoExporter;
import com.example.registry.service.EmployeeNotFoundException;
import com.example.registry.service.EmployeeService;
import com.example.registry.service.InvalidEmployeeRequestException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EmployeeApiController.class)
@Import(ApiExceptionHandler.class)
class EmployeeApiControllerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private EmployeeService employeeService;
  @MockitoBean private EmployeeAutoExporter autoExporter;

  @Test
  void createReturns201WithLocationAndBody() throws Exception {
    when(employeeService.create(new EmployeeDraft("E1", "Alice", null, null, null)))
        .thenReturn(employee(1L, "E1", "Alice"));

    mockMvc
        .perform(
            post("/records")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"externalKey\":\"E1\",\"name\":\"Alice\"}"))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/records/1"))
        .andExpect(jsonPath("$.id").value(1))
        .andExpect(jsonPath("$.externalKey").value("E1"))
        .andExpect(jsonPath("$.createdAt").value("2024-05-01T10:00:00Z"));
  }

  @Test
  void createReturns409OnDuplicateKey() throws Exception {
    when(employeeService.create(any())).thenThrow(new DuplicateExternalKeyException("E1"));

    mockMvc
        .perform(
            post("/records")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"externalKey\":\"E1\",\"name\":\"Bob\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DUPLICATE_KEY"));
  }

  @Test
  void createReturns400WhenNameMissing() throws Exception {
    mockMvc
        .perform(
            post("/records")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"externalKey\":\"E1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("name is required"));
    verifyNoInteractions(employeeService);
  }

  @Test
  void createReturns400WhenNameTooLong() throws Exception {
    final String body = "{\"externalKey\":\"E1\",\"name\":\"" + "n".repeat(101) + "\"}";

    mockMvc
        .perform(post("/records").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("name must be at most 100 characters"));
  }

  @Test
  void updateReturnsRefreshedRecord() throws Exception {
    when(employeeService.update(1L, new EmployeeChanges(null, "Alicia", null, null, null)))
        .thenReturn(employee(1L, "E1", "Alicia"));

    mockMvc
        .perform(
            put("/records/1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Alicia\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.externalKey").value("E1"))
        .andExpect(jsonPath("$.name").value("Alicia"));
  }

  @Test
  void updateReturns404ForUnknownId() throws Exception {
    when(employeeService.update(eq(9L), any())).thenThrow(new EmployeeNotFoundException(9L));

    mockMvc
        .perform(
            put("/records/9").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"x\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("employee 9 not found"));
  }

  @Test
  void updateReturns400WhenNoFieldsSupplied() throws Exception {
    when(employeeService.update(eq(1L), any()))
        .thenThrow(new InvalidEmployeeRequestException("no fields provided for update"));

    mockMvc
        .perform(put("/records/1").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("no fields provided for update"));
  }

  @Test
  void deleteReturns204WithoutBody() throws Exception {
    mockMvc
        .perform(delete("/records/1"))
        .andExpect(status().isNoContent())
        .andExpect(content().string(""));
    verify(employeeService).delete(1L);
  }

  @Test
  void listAppliesDefaultPaging() throws Exception {
    when(employeeService.list(null, 0, 100)).thenReturn(List.of(employee(1L, "E1", "Alice")));

    mockMvc
        .perform(get("/records"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].name").value("Alice"));
  }

  @Test
  void listRejectsOversizedLimit() throws Exception {
    mockMvc
        .perform(get("/records").param("limit", "5000"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    verify(employeeService, never()).list(any(), anyInt(), anyInt());
  }

  @Test
  void listAllTriggersAutomaticExport() throws Exception {
    final List<EmployeeRecord> records = List.of(employee(1L, "E1", "Alice"));
    when(employeeService.listAll()).thenReturn(records);

    mockMvc.perform(get("/records/all")).andExpect(status().isOk());

    verify(autoExporter).export(records);
  }

  @Test
  void searchReturnsMatches() throws Exception {
    when(employeeService.search("ali")).thenReturn(List.of(employee(1L, "E1", "Alice")));

    mockMvc
        .perform(
            post("/search").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"ali\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].externalKey").value("E1"));
  }

  @Test
  void searchReturns400ForMalformedBody() throws Exception {
    mockMvc
        .perform(post("/search").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
    verify(employeeService, never()).search(anyString());
  }

  @Test
  void storeFailureMapsTo500() throws Exception {
    when(employeeService.get(1L))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/records/1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }

  private static EmployeeRecord employee(long id, String externalKey, String name) {
    return new EmployeeRecord(id, externalKey, name, null, null, null, NOW, NOW);
  }
}
