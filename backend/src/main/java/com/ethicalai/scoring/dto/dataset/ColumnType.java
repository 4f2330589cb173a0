package com.ethicalai.scoring.dto.dataset;

import com.fasterxml.jackson.annotation.JsonValue;

/** Inferred storage type of a column, decided over its non-missing cells. */
public enum ColumnType {
  INTEGER("integer"),
  FLOAT("float"),
  BOOLEAN("boolean"),
  CATEGORICAL("categorical");

  private final String label;

  ColumnType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
