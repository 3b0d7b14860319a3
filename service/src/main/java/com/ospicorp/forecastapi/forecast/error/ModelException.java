package com.ospicorp.forecastapi.forecast.error;

public class ModelException extends ForecastException {

  public ModelException(ErrorKind kind, String message) {
    super(kind, message, null);
  }

  public ModelException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
