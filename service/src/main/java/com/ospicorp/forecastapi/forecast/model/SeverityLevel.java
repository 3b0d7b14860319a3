package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SeverityLevel {
  LOW("Low"),
  MEDIUM("Medium"),
  HIGH("High");

  private final String label;

  SeverityLevel(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
