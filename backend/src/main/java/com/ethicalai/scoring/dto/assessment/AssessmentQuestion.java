package com.ethicalai.scoring.dto.assessment;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
@Schema(description = "A questionnaire item; option i scores i points (0-4)")
public class AssessmentQuestion {

  @JsonProperty("id")
  String id;

  @JsonProperty("question")
  String question;

  @JsonProperty("dimension")
  AssessmentDimension dimension;

  @Singular
  @JsonProperty("options")
  List<String> options;
}
