package com.example.registry.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EmployeeChangesTest {

  @Test
  void collectsOnlyNonBlankFieldsInDeclarationOrder() {
    final EmployeeChanges changes = new EmployeeChanges(" E9 ", null, "", "active", "  ");

    assertThat(changes.presentFields())
        .containsExactly(
            Map.entry(EmployeeField.EXTERNAL_KEY, "E9"),
            Map.entry(EmployeeField.STATUS, "active"));
    assertThat(changes.newExternalKey()).contains("E9");
      }

  @Test
  void emptyWhenNothingSupplied() {
    final EmployeeChanges changes = new EmployeeChanges(null, " ", null, null, "");

    assertThat(changes.presentFields()).isEmpty();
    assertThat(changes.newExternalKey()).isEmpty();
  }

  @Test
  void draftNormalizesBlankOptionalFieldsToNull() {
    final EmployeeDraft draft = new EmployeeDraft(" E1 ", " Alice ", " ", "active", "");

    assertThat(draft.externalKey()).isEqualTo("E1");
    assertThat(draft.name()).isEqualTo("Alice");
    assertThat(draft.rights()).isNull();
    assertThat(draft.status()).isEqualTo("active");
    assertThat(draft.remarks()).isNull();
  }
}
