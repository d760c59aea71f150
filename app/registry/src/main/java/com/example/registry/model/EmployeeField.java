/*
 * どこで: app/registry/src/main/java/com/example/registry/model/EmployeeField.java
 * 何を: 部分更新の対象となる列を宣言する
 * なぜ: UPDATE 文の列名を固定の定数から組み立て、入力値が SQL へ混入しないようにするため
 */
package com.example.registry.model;

import java.util.function.Function;

public enum EmployeeField {
  EXTERNAL_KEY("eid", EmployeeChanges::externalKey),
  NAME("name", EmployeeChanges::name),
  RIGHTS("rights", EmployeeChanges::rights),
  STATUS("status", EmployeeChanges::status),
  REMARKS("remarks", EmployeeChanges::remarks);

  private final String column;
  private final Function<EmployeeChanges, String> accessor;

  EmployeeField(String column, Function<EmployeeChanges, String> accessor) {
    this.column = column;
    this.accessor = accessor;
  }

  public String column() {
    return column;
  }

  String valueIn(EmployeeChanges changes) {
    return accessor.apply(changes);
  }
}
