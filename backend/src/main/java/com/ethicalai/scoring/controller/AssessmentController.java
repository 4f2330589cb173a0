package com.ethicalai.scoring.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ethicalai.scoring.dto.assessment.AssessmentQuestion;
import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.dto.assessment.AssessmentScore;
import com.ethicalai.scoring.service.assessment.AssessmentQuestionCatalog;
import com.ethicalai.scoring.service.assessment.AssessmentScoringService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/assessment")
@RequiredArgsConstructor
@Tag(name = "Assessment", description = "Ethics questionnaire and its scoring")
public class AssessmentController {

  private final AssessmentQuestionCatalog catalog;
  private final AssessmentScoringService scoringService;

  @GetMapping(value = "/questions", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List questionnaire items", description = "The fixed twenty questions")
  public ResponseEntity<List<AssessmentQuestion>> getQuestions() {
    return ResponseEntity.ok(catalog.getQuestions());
  }

  @PostMapping(
      value = "/score",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Score questionnaire answers",
      description = "Per-dimension normalized scores and the weighted assessment total")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Answers scored",
            content = @Content(schema = @Schema(implementation = AssessmentScore.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Incomplete assessment or answer out of range",
            content = @Content)
      })
  public ResponseEntity<AssessmentScore> score(@RequestBody AssessmentRequest request) {
    return ResponseEntity.ok(scoringService.score(request));
  }
}
