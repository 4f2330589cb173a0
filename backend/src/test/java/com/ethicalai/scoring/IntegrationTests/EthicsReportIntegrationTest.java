package com.ethicalai.scoring.IntegrationTests;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.fixtures.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;

/** End-to-end report generation through the HTTP layer with the real engine wired in. */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
@DisplayName("Ethics Report Integration Tests")
class EthicsReportIntegrationTest {

  private static byte[] sampleSurvey;

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @BeforeAll
  static void loadSample() {
    sampleSurvey = TestFixtures.createSampleSurveyCsv();
  }

  private MockMultipartFile surveyFile() {
    return new MockMultipartFile("file", "survey.csv", "text/csv", sampleSurvey);
  }

  private MockMultipartFile answersPart(Map<String, Integer> answers) throws Exception {
    return new MockMultipartFile(
        "answers",
        "",
        MediaType.APPLICATION_JSON_VALUE,
        objectMapper
            .writeValueAsString(AssessmentRequest.builder().answers(answers).build())
            .getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Should serve the twenty questionnaire items")
  void shouldServeQuestions() throws Exception {
    mockMvc
        .perform(get("/api/assessment/questions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(20))
        .andExpect(jsonPath("$[0].id").value("t1"))
        .andExpect(jsonPath("$[19].id").value("r1"));
  }

  @Test
  @DisplayName("Should score the skewed sample survey as high risk")
  void shouldAnalyzeSampleBias() throws Exception {
    mockMvc
        .perform(multipart("/api/bias/analyze").file(surveyFile()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.score").value(0))
        .andExpect(jsonPath("$.level").value("HIGH"))
        .andExpect(jsonPath("$.penalty_totals.ClassImbalance").value(70.0))
        .andExpect(jsonPath("$.penalty_totals.ProtectedAttributeBias").value(30.0));
  }

  @Test
  @DisplayName("Should combine a perfect questionnaire with the sample bias score")
  void shouldGenerateComprehensiveReport() throws Exception {
    mockMvc
        .perform(
            multipart("/api/report/comprehensive")
                .file(surveyFile())
                .file(answersPart(TestFixtures.createAnswers(4)))
                .header("X-Correlation-Id", "it-report-1"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Correlation-Id", "it-report-1"))
        .andExpect(jsonPath("$.report_id").isNotEmpty())
        .andExpect(jsonPath("$.dataset_name").value("survey.csv"))
        .andExpect(jsonPath("$.composite_report.assessment_total").value(100.0))
        .andExpect(jsonPath("$.composite_report.bias_score").value(0))
        .andExpect(jsonPath("$.composite_report.ethical_score").value(70))
        .andExpect(jsonPath("$.composite_report.grade").value("Silver"))
        .andExpect(jsonPath("$.composite_report.passes_threshold").value(true))
        .andExpect(jsonPath("$.fingerprint.algorithm").value("SHA-256"))
        .andExpect(jsonPath("$.fingerprint.rows").value(TestFixtures.SAMPLE_ROWS))
        .andExpect(jsonPath("$.fingerprint.columns").value(8))
        .andExpect(jsonPath("$.dataset_profile.protected_attributes.length()").value(3));
  }

  @Test
  @DisplayName("Should fail a middling questionnaire on a biased dataset")
  void shouldGradeNeedsImprovement() throws Exception {
    mockMvc
        .perform(
            multipart("/api/report/comprehensive")
                .file(surveyFile())
                .file(answersPart(TestFixtures.createAnswers(2))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.composite_report.assessment_total").value(50.0))
        .andExpect(jsonPath("$.composite_report.ethical_score").value(35))
        .andExpect(jsonPath("$.composite_report.grade").value("Needs Improvement"))
        .andExpect(jsonPath("$.composite_report.passes_threshold").value(false));
  }

  @Test
  @DisplayName("Should reject an incomplete questionnaire before reading the dataset")
  void shouldRejectIncompleteQuestionnaire() throws Exception {
    mockMvc
        .perform(
            multipart("/api/report/comprehensive")
                .file(surveyFile())
                .file(answersPart(Map.of("t1", 4))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.missingQuestions.length()").value(19))
        .andExpect(jsonPath("$.missingQuestions[0]").value("t2"));
  }

  @Test
  @DisplayName("Should reject an unsupported dataset format")
  void shouldRejectUnsupportedFormat() throws Exception {
    mockMvc
        .perform(
            multipart("/api/dataset/profile")
                .file(
                    new MockMultipartFile(
                        "file",
                        "survey.parquet",
                        "application/octet-stream",
                        "PAR1".getBytes(StandardCharsets.UTF_8))))
        .andExpect(status().isUnsupportedMediaType());
  }

  @Test
  @DisplayName("Should profile a small CSV end to end")
  void shouldProfileSimpleCsv() throws Exception {
    mockMvc
        .perform(
            multipart("/api/dataset/profile")
                .file(
                    new MockMultipartFile(
                        "file", "people.csv", "text/csv", TestFixtures.createSimpleCsv())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.row_count").value(4))
        .andExpect(jsonPath("$.column_count").value(4))
        .andExpect(jsonPath("$.total_missing_cells").value(1))
        .andExpect(jsonPath("$.protected_attributes[0]").value("gender"));
  }
}
