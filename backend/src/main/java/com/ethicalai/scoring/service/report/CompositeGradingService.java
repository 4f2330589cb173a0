package com.ethicalai.scoring.service.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.dto.assessment.AssessmentDimension;
import com.ethicalai.scoring.dto.assessment.AssessmentScore;
import com.ethicalai.scoring.dto.assessment.DimensionScore;
import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.report.CompositeReport;
import com.ethicalai.scoring.dto.report.Grade;

import lombok.extern.slf4j.Slf4j;

/** Blends the questionnaire total with the dataset bias score into a graded report. */
@Slf4j
@Service
public class CompositeGradingService {

  private final EthicsProperties.Grading config;

  public CompositeGradingService(EthicsProperties properties) {
    this.config = properties.getGrading();
    if (!(config.getGoldFloor() >= config.getSilverFloor()
        && config.getSilverFloor() >= config.getBronzeFloor())) {
      throw new IllegalArgumentException("Grade floors must satisfy gold >= silver >= bronze");
    }
    if (Math.abs(config.getAssessmentWeight() + config.getBiasWeight() - 1.0) > 1e-9) {
      throw new IllegalArgumentException("Assessment and bias weights must sum to 1");
    }
  }

  public CompositeReport grade(AssessmentScore assessment, BiasReport biasReport) {
    return grade(
        assessment.getAssessmentTotal(), assessment.getDimensions(), biasReport.getScore());
  }

  public CompositeReport grade(
      double assessmentTotal, List<DimensionScore> dimensions, int biasScore) {
    if (assessmentTotal < 0 || assessmentTotal > 100) {
      throw new IllegalArgumentException(
          "Assessment total must be within [0, 100], got " + assessmentTotal);
    }
    if (biasScore < 0 || biasScore > 100) {
      throw new IllegalArgumentException("Bias score must be within [0, 100], got " + biasScore);
    }
    List<DimensionScore> scored = dimensions == null ? List.of() : List.copyOf(dimensions);

    int ethicalScore = (int) Math.round(blend(assessmentTotal, biasScore));
    Grade grade = gradeFor(ethicalScore);

    CompositeReport report =
        CompositeReport.builder()
            .ethicalScore(ethicalScore)
            .assessmentTotal(assessmentTotal)
            .biasScore(biasScore)
            .grade(grade)
            .dimensions(scored)
            .categoryScores(categoryScores(scored, biasScore))
            .issues(issues(scored))
            .recommendations(recommendations(scored))
            .passesThreshold(ethicalScore >= config.getBadgeThreshold())
            .badgeThreshold(config.getBadgeThreshold())
            .build();

    log.info(
        "Graded report: ethical score {} ({}), assessment {}, bias {}",
        ethicalScore,
        grade.getLabel(),
        assessmentTotal,
        biasScore);
    return report;
  }

  /** Inclusive lower bounds, highest tier first. */
  public Grade gradeFor(int ethicalScore) {
    if (ethicalScore >= config.getGoldFloor()) {
      return Grade.GOLD;
    }
    if (ethicalScore >= config.getSilverFloor()) {
      return Grade.SILVER;
    }
    if (ethicalScore >= config.getBronzeFloor()) {
      return Grade.BRONZE;
    }
    return Grade.NEEDS_IMPROVEMENT;
  }

  private double blend(double assessmentScore, int biasScore) {
    return assessmentScore * config.getAssessmentWeight() + biasScore * config.getBiasWeight();
  }

  private Map<String, Double> categoryScores(List<DimensionScore> dimensions, int biasScore) {
    Map<String, Double> scores = new LinkedHashMap<>();
    for (DimensionScore dimension : dimensions) {
      boolean fairness =
          AssessmentDimension.FAIRNESS_BIAS.getDisplayName().equals(dimension.getName());
      scores.put(
          dimension.getName(),
          fairness
              ? (double) Math.round(blend(dimension.getNormalizedScore(), biasScore))
              : dimension.getNormalizedScore());
    }
    return Collections.unmodifiableMap(scores);
  }

  private List<String> issues(List<DimensionScore> dimensions) {
    List<String> issues = new ArrayList<>();
    for (DimensionScore dimension : dimensions) {
      if (dimension.getNormalizedScore() < config.getIssueThreshold()) {
        issues.add(
            String.format(
                Locale.ROOT,
                "Low score in %s (%.1f%%)",
                dimension.getName(),
                dimension.getNormalizedScore()));
      }
    }
    return List.copyOf(issues);
  }

  private List<String> recommendations(List<DimensionScore> dimensions) {
    return dimensions.stream()
        .filter(d -> d.getNormalizedScore() < config.getRecommendationThreshold())
        .map(d -> resolve(d.getName()))
        .flatMap(Optional::stream)
        .distinct()
        .sorted(Comparator.naturalOrder())
        .limit(config.getMaxRecommendations())
        .map(AssessmentDimension::getRecommendation)
        .collect(Collectors.toUnmodifiableList());
  }

  private Optional<AssessmentDimension> resolve(String name) {
    Optional<AssessmentDimension> dimension = AssessmentDimension.fromDisplayName(name);
    if (dimension.isEmpty()) {
      log.warn("No recommendation for unknown dimension '{}'", name);
    }
    return dimension;
  }
}
