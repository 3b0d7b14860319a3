package com.ospicorp.forecastapi.forecast.model;

// AUTO lets the model decide from the history span and spacing
public enum SeasonalityToggle {
  AUTO,
  TRUE,
  FALSE
}
