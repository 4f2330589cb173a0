package com.ethicalai.scoring.exception;

/** The uploaded dataset could not be read or parsed. Terminal for the request. */
public class DatasetLoadException extends RuntimeException {

  public DatasetLoadException(String message) {
    super(message);
  }

  public DatasetLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
