package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"message", "row_count", "parameters", "metrics", "anomalies", "insights",
    "recommendations", "data"})
public record ForecastAnalysis(
    String message,
    @JsonProperty("row_count") int rowCount,
    Map<String, Object> parameters,
    MetricsSet metrics,
    List<Anomaly> anomalies,
    List<String> insights,
    List<String> recommendations,
    @JsonProperty("data") List<ForecastPoint> forecast
) {
  public ForecastAnalysis {
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    anomalies = List.copyOf(anomalies);
    insights = List.copyOf(insights);
    recommendations = List.copyOf(recommendations);
    forecast = List.copyOf(forecast);
  }
}
