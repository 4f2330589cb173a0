package com.ethicalai.scoring.service.assessment;

import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.ACCOUNTABILITY;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.FAIRNESS_BIAS;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.INCLUSIVITY;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.PRIVACY_CONSENT;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.REGULATION;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.SECURITY;
import static com.ethicalai.scoring.dto.assessment.AssessmentDimension.TRANSPARENCY;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.ethicalai.scoring.dto.assessment.AssessmentDimension;
import com.ethicalai.scoring.dto.assessment.AssessmentQuestion;

/** The fixed twenty-question ethics questionnaire. Option i of every question scores i points. */
@Component
public class AssessmentQuestionCatalog {

  public static final int MAX_SCORE = 4;

  private static final List<AssessmentQuestion> QUESTIONS =
      List.of(
          question(
              "t1",
              TRANSPARENCY,
              "Have you documented the source and collection method of this dataset?",
              "Never", "Rarely", "Sometimes", "Often", "Always"),
          question(
              "t2",
              TRANSPARENCY,
              "Is there a data sheet, model card, or documentation attached to this dataset?",
              "No documentation",
              "Basic info",
              "Partial documentation",
              "Good documentation",
              "Comprehensive documentation"),
          question(
              "t3",
              TRANSPARENCY,
              "Can users understand what data is used and why?",
              "Not at all", "Unclear", "Somewhat clear", "Mostly clear", "Very clear"),
          question(
              "b1",
              FAIRNESS_BIAS,
              "Have you checked for demographic imbalance (e.g., gender, race, age)?",
              "No check done",
              "Basic awareness",
              "Some analysis",
              "Thorough analysis",
              "Comprehensive analysis"),
          question(
              "b2",
              FAIRNESS_BIAS,
              "Did you use any method to reduce/prevent bias in the dataset?",
              "No methods",
              "Minimal effort",
              "Some methods",
              "Multiple methods",
              "Comprehensive approach"),
          question(
              "b3",
              FAIRNESS_BIAS,
              "Have you tested for disparate impact in model predictions across groups?",
              "No testing",
              "Basic testing",
              "Some testing",
              "Regular testing",
              "Comprehensive testing"),
          question(
              "p1",
              PRIVACY_CONSENT,
              "Was the data collected with proper user consent?",
              "No consent",
              "Unclear consent",
              "Basic consent",
              "Clear consent",
              "Explicit informed consent"),
          question(
              "p2",
              PRIVACY_CONSENT,
              "Does this dataset include personally identifiable information (PII)?",
              "Extensive PII", "Some PII", "Minimal PII", "Limited PII", "No PII"),
          question(
              "p3",
              PRIVACY_CONSENT,
              "Have you anonymized or masked sensitive fields?",
              "No anonymization",
              "Minimal effort",
              "Basic anonymization",
              "Good anonymization",
              "Full anonymization"),
          question(
              "p4",
              PRIVACY_CONSENT,
              "Do you follow any privacy regulation (GDPR, DPDP Act, etc.)?",
              "No compliance",
              "Aware but not following",
              "Partial compliance",
              "Good compliance",
              "Full compliance"),
          question(
              "a1",
              ACCOUNTABILITY,
              "Who is responsible for ethical oversight in your project?",
              "No one assigned",
              "Unclear responsibility",
              "Someone assigned",
              "Clear responsibility",
              "Dedicated ethics team"),
          question(
              "a2",
              ACCOUNTABILITY,
              "Is there a system in place for handling AI-related complaints or feedback?",
              "No system",
              "Basic awareness",
              "Informal process",
              "Formal process",
              "Comprehensive system"),
          question(
              "a3",
              ACCOUNTABILITY,
              "Can decisions made using this AI be audited or traced back?",
              "No traceability",
              "Limited logs",
              "Basic tracing",
              "Good tracing",
              "Full audit trail"),
          question(
              "s1",
              SECURITY,
              "Is the dataset stored securely and access-controlled?",
              "No security",
              "Basic security",
              "Moderate security",
              "Good security",
              "Enterprise security"),
          question(
              "s2",
              SECURITY,
              "Has the dataset been validated for tampering or integrity loss?",
              "No validation",
              "Basic checks",
              "Some validation",
              "Regular validation",
              "Comprehensive validation"),
          question(
              "s3",
              SECURITY,
              "Are version changes to this dataset tracked?",
              "No tracking",
              "Basic logs",
              "Some tracking",
              "Good tracking",
              "Full version control"),
          question(
              "i1",
              INCLUSIVITY,
              "Could this AI harm any vulnerable group if used incorrectly?",
              "High risk", "Moderate risk", "Some risk", "Low risk", "Minimal risk"),
          question(
              "i2",
              INCLUSIVITY,
              "Have stakeholders or affected communities been consulted?",
              "No consultation",
              "Minimal consultation",
              "Some consultation",
              "Good consultation",
              "Extensive consultation"),
          question(
              "i3",
              INCLUSIVITY,
              "Does the AI solution benefit society broadly?",
              "No benefit",
              "Minimal benefit",
              "Some benefit",
              "Good benefit",
              "Significant benefit"),
          question(
              "r1",
              REGULATION,
              "Are you aware of the legal responsibilities tied to deploying this dataset?",
              "Not aware",
              "Minimal awareness",
              "Some awareness",
              "Good awareness",
              "Full awareness"));

  public List<AssessmentQuestion> getQuestions() {
    return QUESTIONS;
  }

  public Optional<AssessmentQuestion> find(String questionId) {
    return QUESTIONS.stream().filter(q -> q.getId().equals(questionId)).findFirst();
  }

  public List<AssessmentQuestion> questionsFor(AssessmentDimension dimension) {
    return QUESTIONS.stream()
        .filter(q -> q.getDimension() == dimension)
        .collect(Collectors.toList());
  }

  /**
   * Score of an option label, matched case-insensitively.
   *
   * @throws IllegalArgumentException if the question or the label is unknown
   */
  public int scoreForOption(String questionId, String optionLabel) {
    AssessmentQuestion question =
        find(questionId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown question: " + questionId));
    List<String> options = question.getOptions();
    for (int i = 0; i < options.size(); i++) {
      if (options.get(i).equalsIgnoreCase(optionLabel == null ? "" : optionLabel.trim())) {
        return i;
      }
    }
    throw new IllegalArgumentException(
        "'" + optionLabel + "' is not an option of question " + questionId);
  }

  private static AssessmentQuestion question(
      String id, AssessmentDimension dimension, String text, String... options) {
    if (options.length != MAX_SCORE + 1) {
      throw new IllegalStateException(
          "Question " + id + " must have " + (MAX_SCORE + 1) + " options");
    }
    return AssessmentQuestion.builder()
        .id(id)
        .question(text)
        .dimension(dimension)
        .options(List.of(options))
        .build();
  }
}
