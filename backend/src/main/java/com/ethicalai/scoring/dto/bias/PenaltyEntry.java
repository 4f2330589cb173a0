package com.ethicalai.scoring.dto.bias;

import java.util.List;

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
@Schema(description = "A single deduction from the bias score with its explanation")
public class PenaltyEntry {

  @JsonProperty("category")
  PenaltyCategory category;

  @Schema(description = "Protected attribute the deduction applies to, if any")
  @JsonProperty("attribute")
  String attribute;

  @JsonProperty("points_deducted")
  double pointsDeducted;

  @Singular("reason")
  @JsonProperty("reasoning")
  List<String> reasoning;
}
