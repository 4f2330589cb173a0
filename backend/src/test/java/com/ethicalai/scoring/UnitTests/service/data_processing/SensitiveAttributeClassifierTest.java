package com.ethicalai.scoring.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.ethicalai.scoring.config.EthicsProperties;

@DisplayName("Sensitive Attribute Classifier Tests")
class SensitiveAttributeClassifierTest {

  private SensitiveAttributeClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new SensitiveAttributeClassifier(new EthicsProperties());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "age",
        "Age",
        "customer_age",
        "AgeGroup",
        "gender",
        "RACE",
        "native-country",
        "native_country",
        "nativeCountry",
        "native.country",
        "marital.status",
        "marital-status",
        "education num",
        "workclass",
        "annual income"
      })
  void shouldFlagSensitiveColumnNames(String columnName) {
    assertThat(classifier.isSensitive(columnName)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"percentage", "message", "storage", "traced", "id", "city", "usage"})
  void shouldNotFlagTermsEmbeddedInOtherWords(String columnName) {
    assertThat(classifier.isSensitive(columnName)).isFalse();
  }

  @Test
  void shouldNormalizeDotsLikeOtherSeparators() {
    assertThat(SensitiveAttributeClassifier.normalize("native.country"))
        .isEqualTo("native-country");
    assertThat(SensitiveAttributeClassifier.normalize("Hours.Per Week"))
        .isEqualTo("hours-per-week");
  }

  @Test
  void shouldHonorExplicitOverridesCaseInsensitively() {
    assertThat(classifier.isSensitive("zip_code", List.of("ZIP_CODE"))).isTrue();
    assertThat(classifier.isSensitive("zip_code", List.of("postcode"))).isFalse();
  }

  @Test
  void shouldRejectBlankNames() {
    assertThat(classifier.isSensitive("  ", List.of("  "))).isFalse();
    assertThat(classifier.isSensitive(null)).isFalse();
  }

  @Test
  void shouldUseConfiguredDictionary() {
    EthicsProperties properties = new EthicsProperties();
    properties.getProfile().setSensitiveTerms(List.of("postcode"));
    SensitiveAttributeClassifier custom = new SensitiveAttributeClassifier(properties);

    assertThat(custom.isSensitive("home_postcode")).isTrue();
    assertThat(custom.isSensitive("gender")).isFalse();
  }

  @Test
  void shouldRecognizeTargetCandidates() {
    assertThat(classifier.isTargetCandidate("loan_approved")).isTrue();
    assertThat(classifier.isTargetCandidate("Label")).isTrue();
    assertThat(classifier.isTargetCandidate("workclass")).isFalse();
    assertThat(classifier.isTargetCandidate("city")).isFalse();
  }

  @Test
  void shouldNormalizeCamelCaseAndSeparators() {
    assertThat(SensitiveAttributeClassifier.normalize("NativeCountry")).isEqualTo("native-country");
    assertThat(SensitiveAttributeClassifier.normalize(" marital_status "))
        .isEqualTo("marital-status");
  }
}
