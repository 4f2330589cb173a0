package com.ethicalai.scoring.dto.assessment;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Questionnaire answers, either as scores or as option labels")
public class AssessmentRequest {

  @Schema(description = "Question id to score (0-4)", example = "{\"t1\": 3, \"t2\": 4}")
  @JsonProperty("answers")
  private Map<String, Integer> answers;

  @Schema(description = "Question id to chosen option label; used for ids absent from answers")
  @JsonProperty("option_answers")
  private Map<String, String> optionAnswers;
}
