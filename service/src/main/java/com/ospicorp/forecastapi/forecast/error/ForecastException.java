package com.ospicorp.forecastapi.forecast.error;

/**
 * Base of every failure the analysis pipeline reports. A run either yields a full result or
 * exactly one of these.
 */
public abstract class ForecastException extends RuntimeException {
  private final ErrorKind kind;

  protected ForecastException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
