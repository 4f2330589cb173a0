package com.ethicalai.scoring.dto.report;

import java.util.List;
import java.util.Map;

import com.ethicalai.scoring.dto.assessment.DimensionScore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Combined ethical score, grade, flagged issues and recommendations")
public class CompositeReport {

  @Schema(description = "round(assessment_total x 0.7 + bias_score x 0.3)")
  @JsonProperty("ethical_score")
  int ethicalScore;

  @JsonProperty("assessment_total")
  double assessmentTotal;

  @JsonProperty("bias_score")
  int biasScore;

  @JsonProperty("grade")
  Grade grade;

  @JsonProperty("dimensions")
  List<DimensionScore> dimensions;

  @Schema(description = "Displayed score per dimension; Fairness & Bias is bias-corrected")
  @JsonProperty("category_scores")
  Map<String, Double> categoryScores;

  @JsonProperty("issues")
  List<String> issues;

  @Schema(description = "At most three, in dimension declaration order")
  @JsonProperty("recommendations")
  List<String> recommendations;

  @JsonProperty("passes_threshold")
  boolean passesThreshold;

  @JsonProperty("badge_threshold")
  int badgeThreshold;
}
