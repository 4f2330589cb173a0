package com.ethicalai.scoring.dto.bias;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Deterministic dataset bias score with its penalty trail")
public class BiasReport {

  @Schema(description = "Bias score in [0,100]; higher is less biased")
  @JsonProperty("score")
  int score;

  @JsonProperty("level")
  BiasLevel level;

  @Singular
  @JsonProperty("penalties")
  List<PenaltyEntry> penalties;

  @Schema(description = "Flattened, display-ordered reasoning lines")
  @JsonProperty("reasoning")
  List<String> reasoning;

  @Schema(description = "Points deducted per penalty category code")
  @JsonProperty("penalty_totals")
  Map<String, Double> penaltyTotals;

  @JsonProperty("risk_factors")
  List<String> riskFactors;

  public double totalDeducted() {
    return penalties.stream().mapToDouble(PenaltyEntry::getPointsDeducted).sum();
  }
}
