package com.ospicorp.forecastapi.forecast.error;

// Bad table, missing columns or unparseable timestamps; raised before any model call
public class InputException extends ForecastException {

  public InputException(ErrorKind kind, String message) {
    super(kind, message, null);
  }

  public InputException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
