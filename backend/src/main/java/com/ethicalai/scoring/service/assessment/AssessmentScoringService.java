package com.ethicalai.scoring.service.assessment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.ethicalai.scoring.dto.assessment.AssessmentDimension;
import com.ethicalai.scoring.dto.assessment.AssessmentQuestion;
import com.ethicalai.scoring.dto.assessment.AssessmentRequest;
import com.ethicalai.scoring.dto.assessment.AssessmentScore;
import com.ethicalai.scoring.dto.assessment.DimensionScore;
import com.ethicalai.scoring.exception.IncompleteAssessmentException;

import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates questionnaire answers into seven dimension scores and their weighted total. Every
 * question must be answered; a missing answer is never treated as zero.
 */
@Slf4j
@Service
public class AssessmentScoringService {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final AssessmentQuestionCatalog catalog;

  public AssessmentScoringService(AssessmentQuestionCatalog catalog) {
    this.catalog = catalog;
    BigDecimal weightSum =
        Arrays.stream(AssessmentDimension.values())
            .map(AssessmentDimension::getWeight)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    if (weightSum.compareTo(BigDecimal.ONE) != 0) {
      throw new IllegalStateException("Dimension weights must sum to 1, got " + weightSum);
    }
  }

  public AssessmentScore score(AssessmentRequest request) {
    if (request == null) {
      throw new IncompleteAssessmentException(allQuestionIds());
    }
    return score(resolveAnswers(request.getAnswers(), request.getOptionAnswers()));
  }

  public AssessmentScore score(Map<String, Integer> answers) {
    Map<String, Integer> given = answers == null ? Map.of() : answers;
    given.keySet().stream()
        .filter(id -> catalog.find(id).isEmpty())
        .forEach(id -> log.warn("Ignoring answer to unknown question '{}'", id));

    List<String> missing = new ArrayList<>();
    for (AssessmentQuestion question : catalog.getQuestions()) {
      Integer value = given.get(question.getId());
      if (value == null) {
        missing.add(question.getId());
      } else if (value < 0 || value > AssessmentQuestionCatalog.MAX_SCORE) {
        throw new IllegalArgumentException(
            "Answer to "
                + question.getId()
                + " must be between 0 and "
                + AssessmentQuestionCatalog.MAX_SCORE
                + ", got "
                + value);
      }
    }
    if (!missing.isEmpty()) {
      throw new IncompleteAssessmentException(missing);
    }

    AssessmentScore.AssessmentScoreBuilder builder = AssessmentScore.builder();
    BigDecimal total = BigDecimal.ZERO;
    for (AssessmentDimension dimension : AssessmentDimension.values()) {
      List<AssessmentQuestion> questions = catalog.questionsFor(dimension);
      int sum = questions.stream().mapToInt(q -> given.get(q.getId())).sum();
      double rawAvg = (double) sum / questions.size();
      double normalized = rawAvg / AssessmentQuestionCatalog.MAX_SCORE * 100;

      builder.dimension(
          DimensionScore.builder()
              .name(dimension.getDisplayName())
              .sectionTitle(dimension.getSectionTitle())
              .rawAvg(rawAvg)
              .stars((int) Math.round(rawAvg))
              .weight(dimension.getWeight().doubleValue())
              .normalizedScore(normalized)
              .build());
      total = total.add(BigDecimal.valueOf(normalized).multiply(dimension.getWeight()));
    }

    double assessmentTotal = total.min(HUNDRED).doubleValue();
    log.info("Scored assessment: total={}", assessmentTotal);
    return builder.assessmentTotal(assessmentTotal).build();
  }

  /** Numeric answers win; option labels fill in the questions they leave out. */
  private Map<String, Integer> resolveAnswers(
      Map<String, Integer> answers, Map<String, String> optionAnswers) {
    Map<String, Integer> resolved = new HashMap<>();
    if (optionAnswers != null) {
      optionAnswers.forEach(
          (id, label) -> {
            if (catalog.find(id).isPresent()) {
              resolved.put(id, catalog.scoreForOption(id, label));
            } else {
              log.warn("Ignoring answer to unknown question '{}'", id);
            }
          });
    }
    if (answers != null) {
      answers.forEach(
          (id, value) -> {
            if (value != null) {
              resolved.put(id, value);
            }
          });
    }
    return resolved;
  }

  private List<String> allQuestionIds() {
    List<String> ids = new ArrayList<>();
    catalog.getQuestions().forEach(q -> ids.add(q.getId()));
    return ids;
  }
}
