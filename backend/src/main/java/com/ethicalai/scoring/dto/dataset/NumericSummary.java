package com.ethicalai.scoring.dto.dataset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Five-number summary plus mean and sample standard deviation")
public class NumericSummary {

  @JsonProperty("count")
  long count;

  @JsonProperty("mean")
  double mean;

  @Schema(description = "Sample standard deviation; absent for fewer than two values")
  @JsonProperty("std")
  Double std;

  @JsonProperty("min")
  double min;

  @JsonProperty("q25")
  double q25;

  @JsonProperty("median")
  double median;

  @JsonProperty("q75")
  double q75;

  @JsonProperty("max")
  double max;
}
