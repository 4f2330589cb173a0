package com.ethicalai.scoring.service.bias;

import static com.ethicalai.scoring.fixtures.TestFixtures.balancedProfile;
import static com.ethicalai.scoring.fixtures.TestFixtures.categoricalColumn;
import static com.ethicalai.scoring.fixtures.TestFixtures.distribution;
import static com.ethicalai.scoring.fixtures.TestFixtures.protectedColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.dto.bias.BiasLevel;
import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.bias.PenaltyCategory;
import com.ethicalai.scoring.dto.bias.PenaltyEntry;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.dataset.ProfileOptions;
import com.ethicalai.scoring.fixtures.TestFixtures;
import com.ethicalai.scoring.service.data_processing.DatasetSource;

@DisplayName("Bias Analysis Service Tests")
class BiasAnalysisServiceTest {

  private EthicsProperties properties;
  private BiasAnalysisService biasAnalysisService;

  @BeforeEach
  void setUp() {
    properties = new EthicsProperties();
    biasAnalysisService = new BiasAnalysisService(properties);
  }

  private static DatasetProfile severelySkewed(int rows, int columns) {
    DatasetProfile.DatasetProfileBuilder builder = balancedProfile(rows);
    for (int i = 1; i <= columns; i++) {
      builder.column(categoricalColumn("feature" + i, 0.0, distribution("x", 0.98, "y", 0.02)));
    }
    return builder.build();
  }

  @Test
  void shouldScoreCleanDatasetAtFullMarks() {
    BiasReport report = biasAnalysisService.analyze(balancedProfile(10_000).build());

    assertThat(report.getScore()).isEqualTo(100);
    assertThat(report.getLevel()).isEqualTo(BiasLevel.LOW);
    assertThat(report.getPenalties()).isEmpty();
    assertThat(report.getReasoning()).isEmpty();
    assertThat(report.getRiskFactors()).isEmpty();
    assertThat(report.getPenaltyTotals())
        .containsOnlyKeys(
            "MissingValues", "ClassImbalance", "ProtectedAttributeBias", "DatasetSize")
        .allSatisfy((code, points) -> assertThat(points).isZero());
  }

  @Nested
  @DisplayName("Missing values")
  class MissingValues {

    @Test
    void shouldDeductHalfAPointPerMissingPercentAndListSparseColumns() {
      DatasetProfile profile =
          balancedProfile(10_000)
              .totalMissingPct(12.0)
              .column(categoricalColumn("notes", 34.5, distribution("a", 0.5, "b", 0.5)))
              .build();

      BiasReport report = biasAnalysisService.analyze(profile);

      assertThat(report.getScore()).isEqualTo(94);
      assertThat(report.getReasoning())
          .containsExactly(
              "Missing Values: -6 points",
              "  • 12.00% of all cells are missing",
              "  • High missing values can introduce bias by excluding certain groups",
              "  • Columns with more than 20% missing values:",
              "    - notes: 34.5% missing values");
      assertThat(report.getRiskFactors()).containsExactly("1 column with >20% missing values");
    }

    @Test
    void shouldCapMissingValuePenalty() {
      BiasReport report =
          biasAnalysisService.analyze(balancedProfile(10_000).totalMissingPct(80.0).build());

      assertThat(report.getPenaltyTotals()).containsEntry("MissingValues", 25.0);
      assertThat(report.getScore()).isEqualTo(75);
      assertThat(report.getLevel()).isEqualTo(BiasLevel.MODERATE);
    }

    @Test
    void shouldKeepFractionalDeductionsToOneDecimal() {
      BiasReport report =
          biasAnalysisService.analyze(balancedProfile(10_000).totalMissingPct(3.0).build());

      assertThat(report.getReasoning().get(0)).isEqualTo("Missing Values: -1.5 points");
      assertThat(report.getScore()).isEqualTo(99);
    }
  }

  @Nested
  @DisplayName("Class imbalance")
  class ClassImbalance {

    @Test
    void shouldSeparateSevereAndModerateImbalances() {
      DatasetProfile profile =
          balancedProfile(10_000)
              .column(categoricalColumn("rare", 0.0, distribution("x", 0.99, "y", 0.01)))
              .column(categoricalColumn("skewed", 0.0, distribution("x", 0.93, "y", 0.07)))
              .build();

      BiasReport report = biasAnalysisService.analyze(profile);

      assertThat(report.getScore()).isEqualTo(85);
      assertThat(report.getReasoning())
          .containsExactly(
              "Class Imbalance: -15 points",
              "  • Class imbalance can lead to biased model predictions",
              "  • Severe imbalances detected:",
              "    - rare: minority class = 1.00%",
              "  • Moderate imbalances detected:",
              "    - skewed: minority class = 7.00%");
      assertThat(report.getRiskFactors())
          .containsExactly("1 severely imbalanced feature", "1 moderately imbalanced feature");
    }

    @Test
    void shouldSaturateAtSeventyPoints() {
      BiasReport report = biasAnalysisService.analyze(severelySkewed(10_000, 8));

      assertThat(report.getPenaltyTotals()).containsEntry("ClassImbalance", 70.0);
      assertThat(report.getReasoning().get(0)).isEqualTo("Class Imbalance: -70 points");
      assertThat(report.getScore()).isEqualTo(30);
      assertThat(report.getLevel()).isEqualTo(BiasLevel.HIGH);
    }
  }

  @Nested
  @DisplayName("Protected attributes")
  class ProtectedAttributes {

    @Test
    void shouldDeductForModerateDistributionBias() {
      DatasetProfile profile =
          balancedProfile(10_000)
              .column(protectedColumn("gender", distribution("f", 0.65, "m", 0.35)))
              .protectedAttribute("gender")
              .build();

      BiasReport report = biasAnalysisService.analyze(profile);

      PenaltyEntry entry = report.getPenalties().get(0);
      assertThat(entry.getCategory()).isEqualTo(PenaltyCategory.PROTECTED_ATTRIBUTE_BIAS);
      assertThat(entry.getAttribute()).isEqualTo("gender");
      assertThat(entry.getPointsDeducted()).isEqualTo(5.0);
      assertThat(entry.getReasoning())
          .containsExactly(
              "Protected Attribute Bias (gender): -5 points",
              "  • Moderate distribution bias detected: 0.300");
      assertThat(report.getScore()).isEqualTo(95);
    }

    @Test
    void shouldIgnoreBalancedProtectedAttributes() {
      DatasetProfile profile =
          balancedProfile(10_000)
              .column(protectedColumn("race", distribution("a", 0.34, "b", 0.33, "c", 0.33)))
              .protectedAttribute("race")
              .build();

      assertThat(biasAnalysisService.analyze(profile).getPenalties()).isEmpty();
    }

    @Test
    void shouldCapCumulativeProtectedDeduction() {
      DatasetProfile.DatasetProfileBuilder builder = balancedProfile(10_000);
      for (int i = 1; i <= 6; i++) {
        builder
            .column(protectedColumn("p" + i, distribution("a", 0.9, "b", 0.1)))
            .protectedAttribute("p" + i);
      }

      BiasReport report = biasAnalysisService.analyze(builder.build());

      assertThat(report.getPenaltyTotals()).containsEntry("ProtectedAttributeBias", 45.0);
      assertThat(report.getPenalties()).hasSize(6);
      assertThat(report.getPenalties().get(4).getReasoning().get(0))
          .isEqualTo("Protected Attribute Bias (p5): -5 points (deduction capped)");
      assertThat(report.getPenalties().get(5).getPointsDeducted()).isZero();
      assertThat(report.getScore()).isEqualTo(55);
      assertThat(report.getRiskFactors())
          .containsExactly("6 protected attributes with severe distribution bias");
    }

    @Test
    void shouldUseConfiguredMetric() {
      properties.getBias().setDistributionMetric(DistributionBiasMetric.ENTROPY_DEFICIT);
      BiasAnalysisService entropyService = new BiasAnalysisService(properties);
      DatasetProfile profile =
          balancedProfile(10_000)
              .column(protectedColumn("gender", distribution("f", 0.9, "m", 0.1)))
              .protectedAttribute("gender")
              .build();

      BiasReport report = entropyService.analyze(profile);

      assertThat(report.getReasoning())
          .contains("  • Severe distribution bias detected: 0.531");
    }
  }

  @Nested
  @DisplayName("Dataset size")
  class DatasetSize {

    @Test
    void shouldDeductTenPointsForSmallDatasets() {
      BiasReport report = biasAnalysisService.analyze(balancedProfile(500).build());

      assertThat(report.getReasoning())
          .containsExactly(
              "Dataset Size: -10 points",
              "  • Small dataset size may not represent all groups adequately");
      assertThat(report.getScore()).isEqualTo(90);
      assertThat(report.getRiskFactors()).containsExactly("Small dataset (500 rows)");
    }

    @Test
    void shouldDeductFivePointsForModerateDatasets() {
      BiasReport report = biasAnalysisService.analyze(balancedProfile(3_000).build());

      assertThat(report.getReasoning())
          .containsExactly(
              "Dataset Size: -5 points",
              "  • Moderate dataset size - consider larger sample for better representation");
    }
  }

  @Nested
  @DisplayName("Score budget and level")
  class ScoreAndLevel {

    @Test
    void shouldNeverDeductMoreThanOneHundredPoints() {
      DatasetProfile skewed = severelySkewed(500, 8);
      DatasetProfile profile =
          DatasetProfile.builder()
              .datasetName("worst.csv")
              .rowCount(500)
              .columnCount(skewed.getColumnCount())
              .columns(skewed.getColumns())
              .totalMissingPct(80.0)
              .build();

      BiasReport report = biasAnalysisService.analyze(profile);

      assertThat(report.totalDeducted()).isCloseTo(100.0, within(1e-9));
      assertThat(report.getScore()).isZero();
      assertThat(report.getLevel()).isEqualTo(BiasLevel.HIGH);
      assertThat(report.getReasoning())
          .contains("Dataset Size: -5 points (deduction capped)")
          .startsWith("Missing Values: -25 points");
    }

    @Test
    void shouldMapLevelsMonotonically() {
      BiasLevel previous = biasAnalysisService.levelFor(0);
      for (int score = 1; score <= 100; score++) {
        BiasLevel current = biasAnalysisService.levelFor(score);
        assertThat(current.ordinal()).isLessThanOrEqualTo(previous.ordinal());
        previous = current;
      }
      assertThat(biasAnalysisService.levelFor(49)).isEqualTo(BiasLevel.HIGH);
      assertThat(biasAnalysisService.levelFor(50)).isEqualTo(BiasLevel.MODERATE);
      assertThat(biasAnalysisService.levelFor(79)).isEqualTo(BiasLevel.MODERATE);
      assertThat(biasAnalysisService.levelFor(80)).isEqualTo(BiasLevel.LOW);
    }

    @Test
    void shouldRejectNonMonotonicLevelFloors() {
      properties.getBias().setModerateLevelFloor(85);

      assertThatThrownBy(() -> new BiasAnalysisService(properties))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("moderate <= low");
    }
  }

  @Test
  void shouldReturnReadOnlyCollections() {
    BiasReport report = biasAnalysisService.analyze(severelySkewed(500, 2));

    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> report.getReasoning().add("extra line"));
    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> report.getRiskFactors().clear());
    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> report.getPenaltyTotals().put("MissingValues", 99.0));
    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> report.getPenalties().clear());
    assertThat(report.getPenaltyTotals()).containsEntry("MissingValues", 0.0);
  }

  @Test
  @DisplayName("Captured sample: 9768 rows, skewed features and age at 0.689")
  void shouldReproduceCapturedSampleReport() {
    DatasetProfile profile =
        TestFixtures.createProfiler(properties)
            .profile(
                DatasetSource.of("survey.csv", TestFixtures.createSampleSurveyCsv()),
                ProfileOptions.DEFAULT);

    BiasReport report = biasAnalysisService.analyze(profile);

    assertThat(profile.getRowCount()).isEqualTo(TestFixtures.SAMPLE_ROWS);
    assertThat(profile.getProtectedAttributes()).containsExactly("age", "gender", "race");
    assertThat(profile.column("region").orElseThrow().getMinorityClassRatio())
        .isCloseTo(0.0001, within(0.00001));
    assertThat(report.getScore()).isZero();
    assertThat(report.getLevel()).isEqualTo(BiasLevel.HIGH);

    int ageLine = report.getReasoning().indexOf("Protected Attribute Bias (age): -10 points");
    assertThat(ageLine).isNotNegative();
    assertThat(report.getReasoning().get(ageLine + 1))
        .isEqualTo("  • Severe distribution bias detected: 0.689");
    assertThat(report.getReasoning()).contains("    - region: minority class = 0.01%");
    assertThat(profile.getColumns().stream().filter(c -> c.isCategorical()).count()).isEqualTo(7);
    assertThat(report.getPenaltyTotals())
        .containsEntry("MissingValues", 0.0)
        .containsEntry("ClassImbalance", 70.0)
        .containsEntry("ProtectedAttributeBias", 30.0)
        .containsEntry("DatasetSize", 0.0);
  }
}
