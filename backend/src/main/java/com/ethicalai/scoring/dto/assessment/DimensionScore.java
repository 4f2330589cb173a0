package com.ethicalai.scoring.dto.assessment;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Averaged and normalized score of one questionnaire dimension")
public class DimensionScore {

  @NotBlank
  @JsonProperty("name")
  String name;

  @JsonProperty("section_title")
  String sectionTitle;

  @DecimalMin("0.0")
  @DecimalMax("4.0")
  @JsonProperty("raw_avg")
  double rawAvg;

  @Min(0)
  @Max(5)
  @JsonProperty("stars")
  int stars;

  @JsonProperty("weight")
  double weight;

  @DecimalMin("0.0")
  @DecimalMax("100.0")
  @JsonProperty("normalized_score")
  double normalizedScore;
}
