package com.ethicalai.scoring.dto.dataset;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Caller-supplied hints for profiling: explicit protected columns and the target column. */
@Value
@Builder
public class ProfileOptions {

  public static final ProfileOptions DEFAULT = ProfileOptions.builder().build();

  @Singular List<String> protectedAttributes;

  String targetColumn;

  public static ProfileOptions of(List<String> protectedAttributes, String targetColumn) {
    ProfileOptionsBuilder builder =
        ProfileOptions.builder().targetColumn(blankToNull(targetColumn));
    if (protectedAttributes != null) {
      protectedAttributes.stream()
          .filter(a -> a != null && !a.isBlank())
          .map(String::trim)
          .forEach(builder::protectedAttribute);
    }
    return builder.build();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
