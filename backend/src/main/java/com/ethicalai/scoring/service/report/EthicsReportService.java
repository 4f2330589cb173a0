package com.ethicalai.scoring.service.report;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.dto.assessment.AssessmentScore;
import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.dataset.ProfileOptions;
import com.ethicalai.scoring.dto.fingerprint.Fingerprint;
import com.ethicalai.scoring.dto.report.CompositeReport;
import com.ethicalai.scoring.dto.report.EthicsReport;
import com.ethicalai.scoring.exception.AnalysisTimeoutException;
import com.ethicalai.scoring.exception.DatasetLoadException;
import com.ethicalai.scoring.service.assessment.AssessmentScoringService;
import com.ethicalai.scoring.service.bias.BiasAnalysisService;
import com.ethicalai.scoring.service.data_processing.DatasetProfilerService;
import com.ethicalai.scoring.service.data_processing.DatasetSource;
import com.ethicalai.scoring.service.fingerprint.FingerprintService;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the full pipeline for one upload: answers are scored first so an incomplete questionnaire
 * fails before any parsing, the dataset is profiled on the analysis pool, then fingerprint and
 * bias analysis run side by side before grading.
 */
@Slf4j
@Service
public class EthicsReportService {

  private final DatasetProfilerService profilerService;
  private final FingerprintService fingerprintService;
  private final BiasAnalysisService biasAnalysisService;
  private final AssessmentScoringService scoringService;
  private final CompositeGradingService gradingService;
  private final EthicsProperties properties;
  private final Executor analysisExecutor;

  public EthicsReportService(
      DatasetProfilerService profilerService,
      FingerprintService fingerprintService,
      BiasAnalysisService biasAnalysisService,
      AssessmentScoringService scoringService,
      CompositeGradingService gradingService,
      EthicsProperties properties,
      @Qualifier("analysisExecutor") Executor analysisExecutor) {
    this.profilerService = profilerService;
    this.fingerprintService = fingerprintService;
    this.biasAnalysisService = biasAnalysisService;
    this.scoringService = scoringService;
    this.gradingService = gradingService;
    this.properties = properties;
    this.analysisExecutor = analysisExecutor;
  }

  public EthicsReport generateReport(
      DatasetSource source, AssessmentRequest answers, ProfileOptions options) {
    AssessmentScore assessment = scoringService.score(answers);

    CompletableFuture<DatasetProfile> profile =
        CompletableFuture.supplyAsync(
            () -> profilerService.profile(source, options), analysisExecutor);
    CompletableFuture<Fingerprint> fingerprint =
        profile.thenApplyAsync(p -> fingerprintService.fingerprint(source, p), analysisExecutor);
    CompletableFuture<BiasReport> bias =
        profile.thenApplyAsync(biasAnalysisService::analyze, analysisExecutor);

    long timeoutSeconds = properties.getUpload().getAnalysisTimeoutSeconds();
    try {
      CompletableFuture.allOf(fingerprint, bias).get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      profile.cancel(true);
      fingerprint.cancel(true);
      bias.cancel(true);
      log.error("Analysis of {} timed out after {} seconds", source.getName(), timeoutSeconds);
      throw new AnalysisTimeoutException(source.getName(), timeoutSeconds, e);
    } catch (ExecutionException e) {
      throw unwrap(e.getCause(), source.getName());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DatasetLoadException("Analysis of '" + source.getName() + "' was interrupted", e);
    }

    BiasReport biasReport = bias.join();
    CompositeReport composite = gradingService.grade(assessment, biasReport);

    EthicsReport report =
        EthicsReport.builder()
            .reportId(UUID.randomUUID().toString())
            .datasetName(source.getName())
            .generatedAt(Instant.now())
            .compositeReport(composite)
            .biasReport(biasReport)
            .fingerprint(fingerprint.join())
            .datasetProfile(profile.join())
            .build();
    log.info(
        "Generated report {} for {}: {} ({})",
        report.getReportId(),
        source.getName(),
        composite.getEthicalScore(),
        composite.getGrade().getLabel());
    return report;
  }

  private RuntimeException unwrap(Throwable cause, String datasetName) {
    Throwable current = cause;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof RuntimeException) {
      return (RuntimeException) current;
    }
    log.error("Analysis of {} failed", datasetName, current);
    return new DatasetLoadException("Analysis of '" + datasetName + "' failed", current);
  }
}
