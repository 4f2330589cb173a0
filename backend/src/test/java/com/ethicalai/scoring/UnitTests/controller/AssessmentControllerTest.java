package com.ethicalai.scoring.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.ethicalai.scoring.dto.assessment.AssessmentDimension;
import com.ethicalai.scoring.dto.assessment.AssessmentQuestion;
import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.dto.assessment.AssessmentScore;
import com.ethicalai.scoring.exception.IncompleteAssessmentException;
import com.ethicalai.scoring.fixtures.TestFixtures;
import com.ethicalai.scoring.service.assessment.AssessmentQuestionCatalog;
import com.ethicalai.scoring.service.assessment.AssessmentScoringService;
import com.fasterxml.jackson.databind.ObjectMapper;

@WebMvcTest(AssessmentController.class)
@DisplayName("Assessment Controller Tests")
class AssessmentControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private AssessmentQuestionCatalog catalog;

  @MockitoBean private AssessmentScoringService scoringService;

  @Nested
  @DisplayName("GET /api/assessment/questions")
  class GetQuestions {

    @Test
    @DisplayName("Should list the questionnaire with dimension display names")
    void shouldListQuestions() throws Exception {
      // Given
      when(catalog.getQuestions())
          .thenReturn(
              List.of(
                  AssessmentQuestion.builder()
                      .id("t1")
                      .question("Is the dataset source clearly documented?")
                      .dimension(AssessmentDimension.TRANSPARENCY)
                      .option("Not documented")
                      .option("Fully documented")
                      .build()));

      // When & Then
      mockMvc
          .perform(get("/api/assessment/questions"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].id").value("t1"))
          .andExpect(jsonPath("$[0].dimension").value("Transparency"))
          .andExpect(jsonPath("$[0].options.length()").value(2));
    }
  }

  @Nested
  @DisplayName("POST /api/assessment/score")
  class ScoreAnswers {

    @Test
    @DisplayName("Should return the weighted total")
    void shouldScoreAnswers() throws Exception {
      // Given
      AssessmentRequest request =
          AssessmentRequest.builder().answers(TestFixtures.createAnswers(3)).build();
      when(scoringService.score(any(AssessmentRequest.class)))
          .thenReturn(
              AssessmentScore.builder()
                  .dimension(TestFixtures.dimension(AssessmentDimension.TRANSPARENCY, 75.0))
                  .assessmentTotal(75.0)
                  .build());

      // When & Then
      mockMvc
          .perform(
              post("/api/assessment/score")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.assessment_total").value(75.0))
          .andExpect(jsonPath("$.dimensions[0].name").value("Transparency"))
          .andExpect(jsonPath("$.dimensions[0].stars").value(3));
    }

    @Test
    @DisplayName("Should name the unanswered questions")
    void shouldRejectIncompleteAnswers() throws Exception {
      // Given
      when(scoringService.score(any(AssessmentRequest.class)))
          .thenThrow(new IncompleteAssessmentException(List.of("r1")));

      // When & Then
      mockMvc
          .perform(
              post("/api/assessment/score")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"answers\": {\"t1\": 2}}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.missingQuestions[0]").value("r1"));
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/assessment/score")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"answers\": "))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }
  }
}
