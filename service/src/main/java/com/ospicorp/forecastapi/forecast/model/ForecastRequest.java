package com.ospicorp.forecastapi.forecast.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ForecastRequest(int horizonDays, ModelConfig modelConfig) {
  public ForecastRequest {
    Objects.requireNonNull(modelConfig, "modelConfig");
  }

  public Map<String, Object> describe() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("days", horizonDays);
    params.putAll(modelConfig.describe());
    return params;
  }
}
