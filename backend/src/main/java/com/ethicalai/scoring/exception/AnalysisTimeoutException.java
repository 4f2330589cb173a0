package com.ethicalai.scoring.exception;

public class AnalysisTimeoutException extends RuntimeException {

  public AnalysisTimeoutException(String datasetName, long timeoutSeconds, Throwable cause) {
    super(
        "Analysis of '" + datasetName + "' did not finish within " + timeoutSeconds + " seconds",
        cause);
  }
}
