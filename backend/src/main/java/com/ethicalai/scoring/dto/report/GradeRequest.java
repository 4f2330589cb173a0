package com.ethicalai.scoring.dto.report;

import java.util.List;

import com.ethicalai.scoring.dto.assessment.DimensionScore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inputs of the composite grader")
public class GradeRequest {

  @NotNull
  @DecimalMin("0.0")
  @DecimalMax("100.0")
  @JsonProperty("assessment_total")
  private Double assessmentTotal;

  @NotEmpty
  @Valid
  @JsonProperty("dimensions")
  private List<DimensionScore> dimensions;

  @NotNull
  @Min(0)
  @Max(100)
  @JsonProperty("bias_score")
  private Integer biasScore;
}
