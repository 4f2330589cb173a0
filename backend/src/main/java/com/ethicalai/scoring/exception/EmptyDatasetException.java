package com.ethicalai.scoring.exception;

public class EmptyDatasetException extends DatasetLoadException {

  public EmptyDatasetException(String datasetName) {
    super("Dataset '" + datasetName + "' contains no data rows");
  }
}
