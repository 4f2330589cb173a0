package com.ethicalai.scoring.service.data_processing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.dto.dataset.ColumnProfile;
import com.ethicalai.scoring.dto.dataset.ColumnType;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.dataset.NumericSummary;
import com.ethicalai.scoring.dto.dataset.ProfileOptions;
import com.ethicalai.scoring.exception.EmptyDatasetException;

import lombok.extern.slf4j.Slf4j;

/**
 * Computes column-level and dataset-level statistics. The profile is a pure function of the parsed
 * rows and the profiling options; nothing is cached between calls.
 */
@Slf4j
@Service
public class DatasetProfilerService {

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[-+]?\\d+");
  private static final Pattern FLOAT_PATTERN =
      Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  private final DatasetParsingService parsingService;
  private final SensitiveAttributeClassifier classifier;
  private final EthicsProperties.Profile config;
  private final Set<String> missingMarkers;

  public DatasetProfilerService(
      DatasetParsingService parsingService,
      SensitiveAttributeClassifier classifier,
      EthicsProperties properties) {
    this.parsingService = parsingService;
    this.classifier = classifier;
    this.config = properties.getProfile();
    this.missingMarkers = new HashSet<>(config.getMissingMarkers());
  }

  public DatasetProfile profile(DatasetSource source, ProfileOptions options) {
    return profile(parsingService.parse(source), options);
  }

  public DatasetProfile profile(RawDataset dataset, ProfileOptions options) {
    if (dataset.rowCount() == 0) {
      throw new EmptyDatasetException(dataset.getName());
    }
    ProfileOptions effective = options == null ? ProfileOptions.DEFAULT : options;

    List<String> columns = dataset.getColumns();
    List<List<String>> cells = normalizeCells(dataset);
    warnUnknownColumns(columns, effective.getProtectedAttributes());

    List<ColumnType> types = new ArrayList<>(columns.size());
    for (int c = 0; c < columns.size(); c++) {
      types.add(inferType(column(cells, c)));
    }
    String target = resolveTarget(columns, cells, types, effective.getTargetColumn());

    DatasetProfile.DatasetProfileBuilder builder =
        DatasetProfile.builder()
            .datasetName(dataset.getName())
            .rowCount(dataset.rowCount())
            .columnCount(columns.size())
            .targetColumn(target);

    long totalMissing = 0;
    Map<ColumnType, Integer> dtypeCounts = new EnumMap<>(ColumnType.class);
    for (int c = 0; c < columns.size(); c++) {
      String name = columns.get(c);
      boolean isProtected =
          name.equals(target) || classifier.isSensitive(name, effective.getProtectedAttributes());
      ColumnProfile columnProfile =
          profileColumn(name, types.get(c), column(cells, c), dataset.rowCount(), isProtected);

      builder.column(columnProfile);
      if (isProtected) {
        builder.protectedAttribute(name);
      }
      totalMissing += columnProfile.getMissingCount();
      dtypeCounts.merge(columnProfile.getDtype(), 1, Integer::sum);
      log.debug(
          "Column {}: dtype={}, missing={}, distinct={}, protected={}",
          name,
          columnProfile.getDtype(),
          columnProfile.getMissingCount(),
          columnProfile.getDistinctValues(),
          isProtected);
    }

    long totalCells = (long) dataset.rowCount() * columns.size();
    long duplicates = countDuplicateRows(cells);
    Map<String, Integer> dtypeLabels = new LinkedHashMap<>();
    dtypeCounts.forEach((type, count) -> dtypeLabels.put(type.getLabel(), count));

    DatasetProfile profile =
        builder
            .totalCells(totalCells)
            .totalMissingCells(totalMissing)
            .totalMissingPct(totalCells == 0 ? 0.0 : totalMissing * 100.0 / totalCells)
            .duplicateRowCount(duplicates)
            .duplicatePct(duplicates * 100.0 / dataset.rowCount())
            .dtypeCounts(Collections.unmodifiableMap(dtypeLabels))
            .build();

    log.info(
        "Profiled {}: {} rows x {} columns, {} protected attribute(s), target={}",
        dataset.getName(),
        profile.getRowCount(),
        profile.getColumnCount(),
        profile.getProtectedAttributes().size(),
        target);
    return profile;
  }

  private ColumnProfile profileColumn(
      String name, ColumnType type, List<String> values, int rowCount, boolean isProtected) {
    List<String> present = new ArrayList<>(values.size());
    for (String value : values) {
      if (value != null) {
        present.add(canonical(value, type));
      }
    }
    long missing = (long) values.size() - present.size();

    Map<String, Long> counts = new LinkedHashMap<>();
    for (String value : present) {
      counts.merge(value, 1L, Long::sum);
    }
    boolean categorical =
        type == ColumnType.CATEGORICAL
            || type == ColumnType.BOOLEAN
            || counts.size() <= config.getLowCardinalityThreshold();

    ColumnProfile.ColumnProfileBuilder builder =
        ColumnProfile.builder()
            .name(name)
            .dtype(type)
            .missingCount(missing)
            .missingPct(missing * 100.0 / rowCount)
            .distinctValues(counts.size())
            .uniquePct(counts.size() * 100.0 / rowCount)
            .categorical(categorical && !present.isEmpty())
            .protectedAttribute(isProtected);

    if ((categorical || isProtected) && !present.isEmpty()) {
      Map<String, Double> distribution = distribution(counts, present.size());
      builder
          .valueDistribution(distribution)
          .majorityClassRatio(Collections.max(distribution.values()))
          .minorityClassRatio(Collections.min(distribution.values()));
    }
    if (type.isNumeric() && !present.isEmpty()) {
      builder.numericSummary(summarize(present));
    }
    return builder.build();
  }

  /** Shares of non-missing values, most frequent first; ties keep first-seen order. */
  private Map<String, Double> distribution(Map<String, Long> counts, int nonMissing) {
    List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
    Map<String, Double> distribution = new LinkedHashMap<>();
    for (Map.Entry<String, Long> entry : entries) {
      distribution.put(entry.getKey(), entry.getValue() / (double) nonMissing);
    }
    return Collections.unmodifiableMap(distribution);
  }

  private NumericSummary summarize(List<String> values) {
    double[] sorted = values.stream().mapToDouble(Double::parseDouble).sorted().toArray();
    int n = sorted.length;
    double mean = Arrays.stream(sorted).average().orElse(0.0);
    Double std = null;
    if (n > 1) {
      double squares = 0;
      for (double v : sorted) {
        squares += (v - mean) * (v - mean);
      }
      std = Math.sqrt(squares / (n - 1));
    }
    return NumericSummary.builder()
        .count(n)
        .mean(mean)
        .std(std)
        .min(sorted[0])
        .q25(quantile(sorted, 0.25))
        .median(quantile(sorted, 0.5))
        .q75(quantile(sorted, 0.75))
        .max(sorted[n - 1])
        .build();
  }

  /** Linear interpolation between closest ranks. */
  static double quantile(double[] sorted, double q) {
    double position = q * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
  }

  static ColumnType inferType(List<String> values) {
    boolean sawValue = false;
    boolean allInteger = true;
    boolean allFloat = true;
    boolean allBoolean = true;
    for (String value : values) {
      if (value == null) {
        continue;
      }
      sawValue = true;
      if (allInteger && !isLong(value)) {
        allInteger = false;
      }
      if (allFloat && !FLOAT_PATTERN.matcher(value).matches()) {
        allFloat = false;
      }
      if (allBoolean && !("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value))) {
        allBoolean = false;
      }
      if (!allInteger && !allFloat && !allBoolean) {
        return ColumnType.CATEGORICAL;
      }
    }
    if (!sawValue) {
      return ColumnType.CATEGORICAL;
    }
    if (allInteger) {
      return ColumnType.INTEGER;
    }
    if (allFloat) {
      return ColumnType.FLOAT;
    }
    return allBoolean ? ColumnType.BOOLEAN : ColumnType.CATEGORICAL;
  }

  private static boolean isLong(String value) {
    if (!INTEGER_PATTERN.matcher(value).matches()) {
      return false;
    }
    try {
      Long.parseLong(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  /** Numeric spellings of the same value ("05", "+5") share one distribution key. */
  private static String canonical(String value, ColumnType type) {
    switch (type) {
      case INTEGER:
        return Long.toString(Long.parseLong(value));
      case FLOAT:
        return Double.toString(Double.parseDouble(value));
      case BOOLEAN:
        return value.toLowerCase(Locale.ROOT);
      default:
        return value;
    }
  }

  private String resolveTarget(
      List<String> columns, List<List<String>> cells, List<ColumnType> types, String requested) {
    if (requested != null) {
      Optional<String> match =
          columns.stream().filter(c -> c.equalsIgnoreCase(requested.trim())).findFirst();
      if (match.isEmpty()) {
        log.warn("Target column '{}' is not present in the dataset; ignoring it", requested);
      }
      return match.orElse(null);
    }
    if (!config.isAutoDetectTarget()) {
      return null;
    }
    for (String column : columns) {
      if (classifier.isTargetCandidate(column)) {
        log.debug("Auto-detected target column {} by name", column);
        return column;
      }
    }
    for (int c = 0; c < columns.size(); c++) {
      if (types.get(c).isNumeric() && isBinary(column(cells, c))) {
        log.debug("Auto-detected binary target column {}", columns.get(c));
        return columns.get(c);
      }
    }
    return null;
  }

  private static boolean isBinary(List<String> values) {
    Set<Double> distinct = new HashSet<>();
    for (String value : values) {
      if (value != null) {
        distinct.add(Double.parseDouble(value));
        if (distinct.size() > 2) {
          return false;
        }
      }
    }
    return distinct.equals(Set.of(0.0, 1.0));
  }

  private void warnUnknownColumns(List<String> columns, List<String> explicit) {
    for (String name : explicit) {
      if (columns.stream().noneMatch(c -> c.equalsIgnoreCase(name.trim()))) {
        log.warn("Protected attribute '{}' is not present in the dataset; ignoring it", name);
      }
    }
  }

  /** Trims every cell and replaces missing markers with {@code null}. */
  private List<List<String>> normalizeCells(RawDataset dataset) {
    List<List<String>> normalized = new ArrayList<>(dataset.rowCount());
    for (List<String> row : dataset.getRows()) {
      List<String> cells = new ArrayList<>(row.size());
      for (String cell : row) {
        String trimmed = cell == null ? "" : cell.trim();
        cells.add(missingMarkers.contains(trimmed) ? null : trimmed);
      }
      normalized.add(cells);
    }
    return normalized;
  }

  private static List<String> column(List<List<String>> rows, int index) {
    List<String> values = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      values.add(index < row.size() ? row.get(index) : null);
    }
    return values;
  }

  /** Rows equal cell by cell, missing cells included, count once per repeat. */
  private static long countDuplicateRows(List<List<String>> rows) {
    Set<List<String>> seen = new HashSet<>();
    long duplicates = 0;
    for (List<String> row : rows) {
      if (!seen.add(row)) {
        duplicates++;
      }
    }
    return duplicates;
  }
}
