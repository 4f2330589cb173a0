package com.ethicalai.scoring.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.dto.dataset.ProfileOptions;
import com.ethicalai.scoring.dto.report.CompositeReport;
import com.ethicalai.scoring.dto.report.EthicsReport;
import com.ethicalai.scoring.dto.report.GradeRequest;
import com.ethicalai.scoring.service.data_processing.DatasetUploadService;
import com.ethicalai.scoring.service.report.CompositeGradingService;
import com.ethicalai.scoring.service.report.EthicsReportService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/report")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Composite grading and full ethics reports")
public class EthicsReportController {

  private final CompositeGradingService gradingService;
  private final EthicsReportService reportService;
  private final DatasetUploadService uploadService;

  @PostMapping(
      value = "/grade",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Grade an assessment",
      description = "Blend an assessment total with a bias score into a graded composite report")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Composite report",
            content = @Content(schema = @Schema(implementation = CompositeReport.class))),
        @ApiResponse(responseCode = "400", description = "Invalid input", content = @Content)
      })
  public ResponseEntity<CompositeReport> grade(@Valid @RequestBody GradeRequest request) {
    return ResponseEntity.ok(
        gradingService.grade(
            request.getAssessmentTotal(), request.getDimensions(), request.getBiasScore()));
  }

  @PostMapping(
      value = "/comprehensive",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate a full ethics report",
      description =
          "Score the questionnaire, profile and fingerprint the dataset, score its bias and grade"
              + " the combination")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report generated",
            content = @Content(schema = @Schema(implementation = EthicsReport.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid upload or incomplete assessment",
            content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Empty or unreadable dataset",
            content = @Content),
        @ApiResponse(
            responseCode = "504",
            description = "Analysis did not finish in time",
            content = @Content)
      })
  public ResponseEntity<EthicsReport> comprehensive(
      @Parameter(description = "Dataset file", required = true) @RequestPart("file")
          MultipartFile file,
      @Parameter(description = "Questionnaire answers as JSON", required = true)
          @RequestPart("answers")
          AssessmentRequest answers,
      @Parameter(description = "Columns to treat as protected in addition to name matching")
          @RequestParam(value = "protectedAttributes", required = false)
          List<String> protectedAttributes,
      @Parameter(description = "Target column; auto-detected when omitted")
          @RequestParam(value = "targetColumn", required = false)
          String targetColumn) {

    EthicsReport report =
        reportService.generateReport(
            uploadService.accept(file),
            answers,
            ProfileOptions.of(protectedAttributes, targetColumn));
    return ResponseEntity.ok(report);
  }
}
