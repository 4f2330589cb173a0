package com.ethicalai.scoring.dto.assessment;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Per-dimension scores and their weighted total")
public class AssessmentScore {

  @Singular
  @JsonProperty("dimensions")
  List<DimensionScore> dimensions;

  @Schema(description = "Weighted total in [0,100]")
  @JsonProperty("assessment_total")
  double assessmentTotal;
}
