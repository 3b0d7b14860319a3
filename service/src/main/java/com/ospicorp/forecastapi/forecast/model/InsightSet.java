package com.ospicorp.forecastapi.forecast.model;

import java.util.List;

public record InsightSet(List<String> insights, List<String> recommendations) {
  public InsightSet {
    insights = List.copyOf(insights);
    recommendations = List.copyOf(recommendations);
  }
}
