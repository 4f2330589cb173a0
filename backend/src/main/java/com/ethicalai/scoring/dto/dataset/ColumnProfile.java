package com.ethicalai.scoring.dto.dataset;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Statistics of a single dataset column")
public class ColumnProfile {

  @JsonProperty("name")
  String name;

  @JsonProperty("dtype")
  ColumnType dtype;

  @JsonProperty("missing_count")
  long missingCount;

  @Schema(description = "Missing cells as a percentage of rows (0-100)")
  @JsonProperty("missing_pct")
  double missingPct;

  @JsonProperty("distinct_values")
  long distinctValues;

  @JsonProperty("unique_pct")
  double uniquePct;

  @Schema(description = "Whether the column takes part in class-imbalance analysis")
  @JsonProperty("categorical")
  boolean categorical;

  @JsonProperty("protected")
  boolean protectedAttribute;

  @Schema(description = "Category to share of non-missing values, most frequent first; sums to 1")
  @JsonProperty("value_distribution")
  Map<String, Double> valueDistribution;

  @JsonProperty("minority_class_ratio")
  Double minorityClassRatio;

  @JsonProperty("majority_class_ratio")
  Double majorityClassRatio;

  @JsonProperty("numeric_summary")
  NumericSummary numericSummary;

  @JsonIgnore
  public boolean hasDistribution() {
    return valueDistribution != null && !valueDistribution.isEmpty();
  }
}
