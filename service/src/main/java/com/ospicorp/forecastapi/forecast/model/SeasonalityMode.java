package com.ospicorp.forecastapi.forecast.model;

public enum SeasonalityMode {
  ADDITIVE,
  MULTIPLICATIVE
}
