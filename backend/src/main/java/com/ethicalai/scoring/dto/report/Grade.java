package com.ethicalai.scoring.dto.report;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Grade {
  GOLD("Gold"),
  SILVER("Silver"),
  BRONZE("Bronze"),
  NEEDS_IMPROVEMENT("Needs Improvement");

  private final String label;

  Grade(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
