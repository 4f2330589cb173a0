package com.ethicalai.scoring.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.dataset.ProfileOptions;
import com.ethicalai.scoring.dto.fingerprint.Fingerprint;
import com.ethicalai.scoring.service.bias.BiasAnalysisService;
import com.ethicalai.scoring.service.data_processing.DatasetProfilerService;
import com.ethicalai.scoring.service.data_processing.DatasetSource;
import com.ethicalai.scoring.service.data_processing.DatasetUploadService;
import com.ethicalai.scoring.service.fingerprint.FingerprintService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Dataset Analysis", description = "Dataset profiling, fingerprinting and bias scoring")
public class DatasetAnalysisController {

  private final DatasetUploadService uploadService;
  private final DatasetProfilerService profilerService;
  private final FingerprintService fingerprintService;
  private final BiasAnalysisService biasAnalysisService;

  @PostMapping(
      value = "/dataset/profile",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile a dataset",
      description = "Compute column-level and dataset-level statistics of an uploaded dataset")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Dataset profiled",
            content = @Content(schema = @Schema(implementation = DatasetProfile.class))),
        @ApiResponse(responseCode = "400", description = "Invalid upload", content = @Content),
        @ApiResponse(
            responseCode = "415",
            description = "Unsupported dataset format",
            content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Empty or unreadable dataset",
            content = @Content)
      })
  public ResponseEntity<DatasetProfile> profile(
      @Parameter(description = "Dataset file (CSV, TSV, JSON or Excel)", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Columns to treat as protected in addition to name matching")
          @RequestParam(value = "protectedAttributes", required = false)
          List<String> protectedAttributes,
      @Parameter(description = "Target column; auto-detected when omitted")
          @RequestParam(value = "targetColumn", required = false)
          String targetColumn) {

    DatasetSource source = uploadService.accept(file);
    DatasetProfile profile =
        profilerService.profile(source, ProfileOptions.of(protectedAttributes, targetColumn));
    return ResponseEntity.ok(profile);
  }

  @PostMapping(
      value = "/dataset/fingerprint",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Fingerprint a dataset",
      description = "SHA-256 content hash, size and shape of an uploaded dataset")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Fingerprint generated",
            content = @Content(schema = @Schema(implementation = Fingerprint.class))),
        @ApiResponse(responseCode = "400", description = "Invalid upload", content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Empty or unreadable dataset",
            content = @Content)
      })
  public ResponseEntity<Fingerprint> fingerprint(
      @Parameter(description = "Dataset file", required = true) @RequestParam("file")
          MultipartFile file) {

    DatasetSource source = uploadService.accept(file);
    DatasetProfile profile = profilerService.profile(source, ProfileOptions.DEFAULT);
    return ResponseEntity.ok(fingerprintService.fingerprint(source, profile));
  }

  @PostMapping(
      value = "/bias/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Score dataset bias",
      description =
          "Profile the dataset and derive a 0-100 bias score with its penalty reasoning trail")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Bias analysis completed",
            content = @Content(schema = @Schema(implementation = BiasReport.class))),
        @ApiResponse(responseCode = "400", description = "Invalid upload", content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Empty or unreadable dataset",
            content = @Content)
      })
  public ResponseEntity<BiasReport> analyzeBias(
      @Parameter(description = "Dataset file", required = true) @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Columns to treat as protected in addition to name matching")
          @RequestParam(value = "protectedAttributes", required = false)
          List<String> protectedAttributes,
      @Parameter(description = "Target column; auto-detected when omitted")
          @RequestParam(value = "targetColumn", required = false)
          String targetColumn) {

    DatasetSource source = uploadService.accept(file);
    DatasetProfile profile =
        profilerService.profile(source, ProfileOptions.of(protectedAttributes, targetColumn));
    return ResponseEntity.ok(biasAnalysisService.analyze(profile));
  }
}
