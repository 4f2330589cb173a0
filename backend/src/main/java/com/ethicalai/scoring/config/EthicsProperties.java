package com.ethicalai.scoring.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.ethicalai.scoring.service.bias.DistributionBiasMetric;

import lombok.Data;

/**
 * Named thresholds and weights of the scoring engine. Defaults reproduce the reference reports;
 * every value can be overridden under the {@code ethics} prefix.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ethics")
public class EthicsProperties {

  private Profile profile = new Profile();
  private Bias bias = new Bias();
  private Grading grading = new Grading();
  private Upload upload = new Upload();

  @Data
  public static class Profile {
    private List<String> missingMarkers =
        new ArrayList<>(
            List.of(
                "", "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "null", "NULL", "None", "#N/A",
                "<NA>", "?"));

    /** Numeric columns with at most this many distinct values are treated as categorical. */
    private int lowCardinalityThreshold = 10;

    private List<String> sensitiveTerms =
        new ArrayList<>(
            List.of(
                "gender",
                "sex",
                "race",
                "ethnicity",
                "ethnic",
                "age",
                "birth",
                "income",
                "salary",
                "wage",
                "marital",
                "relationship",
                "education",
                "native-country",
                "nationality",
                "citizenship",
                "religion",
                "disability",
                "workclass",
                "sexual-orientation"));

    private boolean autoDetectTarget = true;

    private List<String> targetKeywords =
        new ArrayList<>(
            List.of(
                "target", "label", "outcome", "class", "approved", "accepted", "default", "fraud",
                "churn", "income"));
  }

  @Data
  public static class Bias {
    /** Points deducted per percent of missing cells. */
    private double missingPointsPerPercent = 0.5;

    private double missingCap = 25;

    /** Columns above this missing percentage are named in the reasoning. */
    private double highMissingColumnPct = 20;

    private double severeImbalanceRatio = 0.05;
    private double moderateImbalanceRatio = 0.10;
    private double severeImbalancePoints = 10;
    private double moderateImbalancePoints = 5;
    private double imbalanceCap = 70;

    private DistributionBiasMetric distributionMetric = DistributionBiasMetric.DOMINANCE;
    private double severeDistributionBias = 0.5;
    private double moderateDistributionBias = 0.25;
    private double severeProtectedPoints = 10;
    private double moderateProtectedPoints = 5;
    private double protectedCap = 45;

    private int smallDatasetRows = 1000;
    private int moderateDatasetRows = 5000;
    private double smallDatasetPoints = 10;
    private double moderateDatasetPoints = 5;

    /** Scores at or above this floor are MODERATE risk. */
    private int moderateLevelFloor = 50;

    /** Scores at or above this floor are LOW risk. */
    private int lowLevelFloor = 80;
  }

  @Data
  public static class Grading {
    private double assessmentWeight = 0.7;
    private double biasWeight = 0.3;
    private int goldFloor = 85;
    private int silverFloor = 70;
    private int bronzeFloor = 55;
    private double issueThreshold = 50;
    private double recommendationThreshold = 70;
    private int maxRecommendations = 3;
    private int badgeThreshold = 70;
  }

  @Data
  public static class Upload {
    private long maxFileSize = 100L * 1024 * 1024;
    private List<String> allowedExtensions =
        new ArrayList<>(List.of("csv", "tsv", "json", "xlsx", "xls"));
    private long analysisTimeoutSeconds = 120;
  }
}
