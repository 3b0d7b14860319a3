package com.ospicorp.forecastapi.forecast.model;

import java.util.List;

// History as fitted (sorted) and the forecast covering history plus horizon
public record ForecastRun(List<TimeSeriesPoint> history, List<ForecastPoint> forecast) {
  public ForecastRun {
    history = List.copyOf(history);
    forecast = List.copyOf(forecast);
  }
}
