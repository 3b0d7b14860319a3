package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"MAE", "RMSE", "MAPE"})
public record MetricsSet(
    @JsonProperty("MAE") double mae,
    @JsonProperty("RMSE") double rmse,
    @JsonProperty("MAPE") double mape
) {
  public static MetricsSet zero() {
    return new MetricsSet(0d, 0d, 0d);
  }
}
