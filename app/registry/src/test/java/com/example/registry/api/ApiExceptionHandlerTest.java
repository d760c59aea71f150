package com.example.registry.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.registry.service.DuplicateExternalKeyException;
import com.example.registry.service.EmployeeNotFoundException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.BadSqlGrammarException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void duplicateKeyReturns409() {
    final var response = handler.handleDuplicateKey(new DuplicateExternalKeyException("E1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                ApiErrorCode.DUPLICATE_KEY, "employee with externalKey 'E1' already exists"));
  }

  @Test
  void notFoundReturns404() {
    final var response = handler.handleNotFound(new EmployeeNotFoundException(3L));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.NOT_FOUND);
  }

  @Test
  void unreachableStoreReturns500WithoutInternals() {
    final var response =
        handler.handleStoreUnavailable(new DataAccessResourceFailureException("refused: 10.0.0.5"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.STORE_UNAVAILABLE);
    assertThat(response.getBody().message()).doesNotContain("10.0.0.5");
  }

  @Test
  void otherStoreErrorsReturn500() {
    final var response =
        handler.handleStoreError(
            new BadSqlGrammarException("select", "SELECT", new SQLException("boom")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.STORE_ERROR);
  }

  @Test
  void unexpectedErrorsReturn500() {
    final var response = handler.handleRuntime(new IllegalStateException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.INTERNAL_ERROR);
  }
}
