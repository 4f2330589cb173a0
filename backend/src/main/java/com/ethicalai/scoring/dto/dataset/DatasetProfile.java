package com.ethicalai.scoring.dto.dataset;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Column-level and dataset-level statistics of an uploaded dataset")
public class DatasetProfile {

  @JsonProperty("dataset_name")
  String datasetName;

  @JsonProperty("row_count")
  int rowCount;

  @JsonProperty("column_count")
  int columnCount;

  @Singular
  @JsonProperty("columns")
  List<ColumnProfile> columns;

  @JsonProperty("duplicate_row_count")
  long duplicateRowCount;

  @JsonProperty("duplicate_pct")
  double duplicatePct;

  @JsonProperty("total_cells")
  long totalCells;

  @JsonProperty("total_missing_cells")
  long totalMissingCells;

  @Schema(description = "Missing cells over all cells, as a percentage (0-100)")
  @JsonProperty("total_missing_pct")
  double totalMissingPct;

  @Singular
  @JsonProperty("protected_attributes")
  List<String> protectedAttributes;

  @JsonProperty("target_column")
  String targetColumn;

  @Schema(description = "Number of columns per inferred dtype")
  @JsonProperty("dtype_counts")
  Map<String, Integer> dtypeCounts;

  @JsonIgnore
  public Optional<ColumnProfile> column(String name) {
    return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
  }
}
