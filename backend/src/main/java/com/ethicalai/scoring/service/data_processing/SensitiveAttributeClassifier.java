package com.ethicalai.scoring.service.data_processing;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.ethicalai.scoring.config.EthicsProperties;

/**
 * Decides from a column name alone whether the column holds a protected attribute or looks like a
 * prediction target. Terms are matched as whole words, so {@code age} flags {@code Age} and
 * {@code customer_age} but not {@code percentage}.
 */
@Component
public class SensitiveAttributeClassifier {

  private final List<Pattern> sensitivePatterns;
  private final List<Pattern> targetPatterns;

  public SensitiveAttributeClassifier(EthicsProperties properties) {
    this.sensitivePatterns = compile(properties.getProfile().getSensitiveTerms());
    this.targetPatterns = compile(properties.getProfile().getTargetKeywords());
  }

  public boolean isSensitive(String columnName) {
    return isSensitive(columnName, List.of());
  }

  public boolean isSensitive(String columnName, Collection<String> explicitOverrides) {
    if (columnName == null || columnName.isBlank()) {
      return false;
    }
    if (explicitOverrides != null
        && explicitOverrides.stream()
            .anyMatch(name -> name != null && name.trim().equalsIgnoreCase(columnName.trim()))) {
      return true;
    }
    return matchesAny(sensitivePatterns, columnName);
  }

  public boolean isTargetCandidate(String columnName) {
    return columnName != null && matchesAny(targetPatterns, columnName);
  }

  /** Lowercases and splits camelCase, underscores, dots and spaces into hyphen-separated words. */
  static String normalize(String columnName) {
    return columnName
        .trim()
        .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
        .toLowerCase(Locale.ROOT)
        .replaceAll("[_\\s.]+", "-");
  }

  private static boolean matchesAny(List<Pattern> patterns, String columnName) {
    String normalized = normalize(columnName);
    return patterns.stream().anyMatch(p -> p.matcher(normalized).find());
  }

  private static List<Pattern> compile(List<String> terms) {
    return terms.stream()
        .filter(t -> t != null && !t.isBlank())
        .map(SensitiveAttributeClassifier::normalize)
        .map(t -> Pattern.compile("(^|[^a-z])" + Pattern.quote(t) + "([^a-z]|$)"))
        .collect(Collectors.toList());
  }
}
