package com.ospicorp.forecastapi.forecast.error;

public class InternalAnalysisException extends ForecastException {

  public InternalAnalysisException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
