package com.ethicalai.scoring.exception;

public class UnsupportedFormatException extends DatasetLoadException {

  private final String extension;

  public UnsupportedFormatException(String extension) {
    super("Unsupported dataset format: '" + extension + "'");
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }
}
