package com.ethicalai.scoring.service.data_processing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.ethicalai.scoring.exception.UnsupportedFormatException;

/** Tabular encodings the loader understands, keyed by file extension. */
public enum DatasetFormat {
  CSV("csv"),
  TSV("tsv", "tab"),
  JSON("json"),
  EXCEL("xlsx", "xls");

  private final List<String> extensions;

  DatasetFormat(String... extensions) {
    this.extensions = List.of(extensions);
  }

  public List<String> getExtensions() {
    return extensions;
  }

  public static DatasetFormat fromFileName(String fileName) {
    return fromExtension(extractExtension(fileName));
  }

  public static DatasetFormat fromExtension(String extension) {
    String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(format -> format.extensions.contains(normalized))
        .findFirst()
        .orElseThrow(() -> new UnsupportedFormatException(normalized));
  }

  public static String extractExtension(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
