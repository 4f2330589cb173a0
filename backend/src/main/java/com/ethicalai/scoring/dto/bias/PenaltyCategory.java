package com.ethicalai.scoring.dto.bias;

import com.fasterxml.jackson.annotation.JsonValue;

/** Penalty categories, declared in the order their reasoning is reported. */
public enum PenaltyCategory {
  MISSING_VALUES("MissingValues", "Missing Values"),
  CLASS_IMBALANCE("ClassImbalance", "Class Imbalance"),
  PROTECTED_ATTRIBUTE_BIAS("ProtectedAttributeBias", "Protected Attribute Bias"),
  DATASET_SIZE("DatasetSize", "Dataset Size");

  private final String code;
  private final String displayName;

  PenaltyCategory(String code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public String getDisplayName() {
    return displayName;
  }
}
