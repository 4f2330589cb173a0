package com.ethicalai.scoring.dto.assessment;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The seven weighted questionnaire dimensions in declaration order. Weights are held as decimals so
 * that their sum is exactly one.
 */
public enum AssessmentDimension {
  TRANSPARENCY(
      "Transparency", "Transparency & Documentation", "0.20", "Enhance data documentation"),
  FAIRNESS_BIAS("Fairness & Bias", "Fairness & Bias", "0.20", "Use bias detection tools"),
  PRIVACY_CONSENT("Privacy & Consent", "Privacy & Consent", "0.20", "Enhance anonymization"),
  ACCOUNTABILITY("Accountability", "Accountability", "0.15", "Add audit trails"),
  SECURITY("Security", "Security & Integrity", "0.10", "Strengthen encryption"),
  INCLUSIVITY("Inclusivity", "Inclusivity & Social Impact", "0.10", "Engage stakeholders"),
  REGULATION("Regulation", "Regulatory Compliance", "0.05", "Ensure policy compliance");

  private final String displayName;
  private final String sectionTitle;
  private final BigDecimal weight;
  private final String recommendation;

  AssessmentDimension(
      String displayName, String sectionTitle, String weight, String recommendation) {
    this.displayName = displayName;
    this.sectionTitle = sectionTitle;
    this.weight = new BigDecimal(weight);
    this.recommendation = recommendation;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  public String getSectionTitle() {
    return sectionTitle;
  }

  public BigDecimal getWeight() {
    return weight;
  }

  public String getRecommendation() {
    return recommendation;
  }

  public static Optional<AssessmentDimension> fromDisplayName(String name) {
    return Arrays.stream(values()).filter(d -> d.displayName.equals(name)).findFirst();
  }
}
