package com.ospicorp.forecastapi.forecast.error;

public enum ErrorKind {
  UNREADABLE_TABLE,
  MISSING_SOURCE,
  NO_DATE_COLUMN,
  NO_TARGET_COLUMN,
  DATE_PARSE_FAILURE,
  INVALID_HORIZON,
  INSUFFICIENT_DATA,
  MODEL_FAILURE,
  INTERNAL
}
