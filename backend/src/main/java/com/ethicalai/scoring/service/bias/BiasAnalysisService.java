package com.ethicalai.scoring.service.bias;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.dto.bias.BiasLevel;
import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.bias.PenaltyCategory;
import com.ethicalai.scoring.dto.bias.PenaltyEntry;
import com.ethicalai.scoring.dto.dataset.ColumnProfile;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;

import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic bias score of a profiled dataset. Starts at 100 and deducts, in order, for missing
 * values, class imbalance, skewed protected attributes and small sample size. Deductions never
 * exceed 100 in total, so the score floors at 0.
 */
@Slf4j
@Service
public class BiasAnalysisService {

  static final double BASELINE = 100.0;
  static final String CAPPED_MARKER = " (deduction capped)";

  private final EthicsProperties.Bias config;

  public BiasAnalysisService(EthicsProperties properties) {
    this.config = properties.getBias();
    validate(config);
  }

  public BiasReport analyze(DatasetProfile profile) {
    Ledger ledger = new Ledger();
    RiskFactors risks = new RiskFactors();

    applyMissingValues(profile, ledger, risks);
    applyClassImbalance(profile, ledger, risks);
    applyProtectedAttributes(profile, ledger, risks);
    applyDatasetSize(profile, ledger, risks);

    int score = (int) Math.max(0, Math.min(100, Math.round(BASELINE - ledger.total)));
    BiasLevel level = levelFor(score);

    List<String> reasoning = new ArrayList<>();
    Map<String, Double> totals = new LinkedHashMap<>();
    for (PenaltyCategory category : PenaltyCategory.values()) {
      totals.put(category.getCode(), 0.0);
    }
    for (PenaltyEntry entry : ledger.entries) {
      reasoning.addAll(entry.getReasoning());
      totals.merge(entry.getCategory().getCode(), entry.getPointsDeducted(), Double::sum);
    }
    totals.replaceAll((code, points) -> roundPoints(points));

    log.info(
        "Bias analysis of {}: score={}, level={}, {} penalty entries",
        profile.getDatasetName(),
        score,
        level,
        ledger.entries.size());

    return BiasReport.builder()
        .score(score)
        .level(level)
        .penalties(ledger.entries)
        .reasoning(List.copyOf(reasoning))
        .penaltyTotals(Collections.unmodifiableMap(totals))
        .riskFactors(List.copyOf(risks.lines))
        .build();
  }

  /** Maps a score to its risk level; lower scores never map to a lower risk. */
  public BiasLevel levelFor(int score) {
    if (score >= config.getLowLevelFloor()) {
      return BiasLevel.LOW;
    }
    if (score >= config.getModerateLevelFloor()) {
      return BiasLevel.MODERATE;
    }
    return BiasLevel.HIGH;
  }

  private void applyMissingValues(DatasetProfile profile, Ledger ledger, RiskFactors risks) {
    double missingPct = profile.getTotalMissingPct();
    double raw = missingPct * config.getMissingPointsPerPercent();
    double points = roundPoints(Math.min(raw, config.getMissingCap()));
    if (points <= 0) {
      return;
    }

    List<String> details = new ArrayList<>();
    details.add(String.format(Locale.ROOT, "  • %.2f%% of all cells are missing", missingPct));
    details.add("  • High missing values can introduce bias by excluding certain groups");
    List<ColumnProfile> sparse = new ArrayList<>();
    for (ColumnProfile column : profile.getColumns()) {
      if (column.getMissingPct() > config.getHighMissingColumnPct()) {
        sparse.add(column);
      }
    }
    if (!sparse.isEmpty()) {
      details.add(
          String.format(
              Locale.ROOT,
              "  • Columns with more than %s%% missing values:",
              formatPoints(config.getHighMissingColumnPct())));
      for (ColumnProfile column : sparse) {
        details.add(
            String.format(
                Locale.ROOT,
                "    - %s: %.1f%% missing values",
                column.getName(),
                column.getMissingPct()));
      }
      risks.add(
          sparse.size(),
          "column",
          "with >" + formatPoints(config.getHighMissingColumnPct()) + "% missing values");
    }
    ledger.record(PenaltyCategory.MISSING_VALUES, null, points, false, details);
  }

  private void applyClassImbalance(DatasetProfile profile, Ledger ledger, RiskFactors risks) {
    List<ColumnProfile> severe = new ArrayList<>();
    List<ColumnProfile> moderate = new ArrayList<>();
    for (ColumnProfile column : profile.getColumns()) {
      if (!column.isCategorical() || column.getMinorityClassRatio() == null) {
        continue;
      }
      double minority = column.getMinorityClassRatio();
      if (minority < config.getSevereImbalanceRatio()) {
        severe.add(column);
      } else if (minority < config.getModerateImbalanceRatio()) {
        moderate.add(column);
      }
    }
    if (severe.isEmpty() && moderate.isEmpty()) {
      return;
    }

    double raw =
        severe.size() * config.getSevereImbalancePoints()
            + moderate.size() * config.getModerateImbalancePoints();
    double points = roundPoints(Math.min(raw, config.getImbalanceCap()));

    List<String> details = new ArrayList<>();
    details.add("  • Class imbalance can lead to biased model predictions");
    if (!severe.isEmpty()) {
      details.add("  • Severe imbalances detected:");
      severe.forEach(c -> details.add(minorityLine(c)));
      risks.add(severe.size(), "severely imbalanced feature", "");
    }
    if (!moderate.isEmpty()) {
      details.add("  • Moderate imbalances detected:");
      moderate.forEach(c -> details.add(minorityLine(c)));
      risks.add(moderate.size(), "moderately imbalanced feature", "");
    }
    ledger.record(PenaltyCategory.CLASS_IMBALANCE, null, points, false, details);
  }

  private void applyProtectedAttributes(DatasetProfile profile, Ledger ledger, RiskFactors risks) {
    DistributionBiasMetric metric = config.getDistributionMetric();
    double protectedSoFar = 0.0;
    int severeCount = 0;

    for (String attribute : profile.getProtectedAttributes()) {
      ColumnProfile column = profile.column(attribute).orElse(null);
      if (column == null || !column.hasDistribution()) {
        log.debug("Skipping protected attribute {} without a value distribution", attribute);
        continue;
      }
      double value = metric.compute(column.getValueDistribution().values());
      double points;
      String label;
      if (value >= config.getSevereDistributionBias()) {
        points = config.getSevereProtectedPoints();
        label = "Severe";
        severeCount++;
      } else if (value >= config.getModerateDistributionBias()) {
        points = config.getModerateProtectedPoints();
        label = "Moderate";
      } else {
        log.debug("Protected attribute {} is balanced ({} = {})", attribute, metric, value);
        continue;
      }

      double allowed = Math.max(0.0, config.getProtectedCap() - protectedSoFar);
      double applied = Math.min(points, allowed);
      protectedSoFar += applied;
      ledger.record(
          PenaltyCategory.PROTECTED_ATTRIBUTE_BIAS,
          attribute,
          applied,
          applied < points,
          List.of(
              String.format(
                  Locale.ROOT, "  • %s distribution bias detected: %.3f", label, value)));
    }
    risks.add(severeCount, "protected attribute", "with severe distribution bias");
  }

  private void applyDatasetSize(DatasetProfile profile, Ledger ledger, RiskFactors risks) {
    int rows = profile.getRowCount();
    if (rows < config.getSmallDatasetRows()) {
      ledger.record(
          PenaltyCategory.DATASET_SIZE,
          null,
          config.getSmallDatasetPoints(),
          false,
          List.of("  • Small dataset size may not represent all groups adequately"));
      risks.lines.add(String.format(Locale.ROOT, "Small dataset (%d rows)", rows));
    } else if (rows < config.getModerateDatasetRows()) {
      ledger.record(
          PenaltyCategory.DATASET_SIZE,
          null,
          config.getModerateDatasetPoints(),
          false,
          List.of(
              "  • Moderate dataset size - consider larger sample for better representation"));
    }
  }

  private static String minorityLine(ColumnProfile column) {
    return String.format(
        Locale.ROOT,
        "    - %s: minority class = %.2f%%",
        column.getName(),
        column.getMinorityClassRatio() * 100);
  }

  static double roundPoints(double points) {
    return Math.round(points * 10) / 10.0;
  }

  /** Whole numbers print without decimals, everything else with one. */
  static String formatPoints(double points) {
    if (points == Math.rint(points)) {
      return Long.toString((long) points);
    }
    return String.format(Locale.ROOT, "%.1f", points);
  }

  private static void validate(EthicsProperties.Bias config) {
    if (config.getModerateLevelFloor() < 0
        || config.getLowLevelFloor() > 100
        || config.getModerateLevelFloor() > config.getLowLevelFloor()) {
      throw new IllegalArgumentException(
          "Bias level floors must satisfy 0 <= moderate <= low <= 100, got moderate="
              + config.getModerateLevelFloor()
              + ", low="
              + config.getLowLevelFloor());
    }
    if (config.getModerateDistributionBias() > config.getSevereDistributionBias()) {
      throw new IllegalArgumentException(
          "Moderate distribution-bias threshold must not exceed the severe threshold");
    }
    if (config.getSevereImbalanceRatio() > config.getModerateImbalanceRatio()) {
      throw new IllegalArgumentException(
          "Severe imbalance ratio must not exceed the moderate imbalance ratio");
    }
    if (config.getDistributionMetric() == null) {
      throw new IllegalArgumentException("A distribution-bias metric must be configured");
    }
  }

  /** Ordered penalty entries whose sum is held at or below the baseline. */
  private static final class Ledger {
    private final List<PenaltyEntry> entries = new ArrayList<>();
    private double total;

    void record(
        PenaltyCategory category,
        String attribute,
        double points,
        boolean alreadyCapped,
        List<String> details) {
      double applied = Math.max(0.0, roundPoints(Math.min(points, BASELINE - total)));
      boolean capped = alreadyCapped || applied < points;
      total += applied;

      String header =
          category.getDisplayName()
              + (attribute == null ? "" : " (" + attribute + ")")
              + ": -"
              + formatPoints(applied)
              + " points"
              + (capped ? CAPPED_MARKER : "");
      entries.add(
          PenaltyEntry.builder()
              .category(category)
              .attribute(attribute)
              .pointsDeducted(applied)
              .reason(header)
              .reasoning(details)
              .build());
    }
  }

  private static final class RiskFactors {
    private final List<String> lines = new ArrayList<>();

    void add(int count, String noun, String suffix) {
      if (count <= 0) {
        return;
      }
      String line = count + " " + noun + (count == 1 ? "" : "s");
      lines.add(suffix.isEmpty() ? line : line + " " + suffix);
    }
  }
}
