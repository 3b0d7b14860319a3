package com.ospicorp.forecastapi.forecast.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record ModelConfig(
    SeasonalityMode seasonalityMode,
    Growth growth,
    SeasonalityToggle dailySeasonality,
    SeasonalityToggle weeklySeasonality,
    SeasonalityToggle yearlySeasonality,
    double intervalWidth,
    int uncertaintySamples,
    Long randomSeed
) {
  public static final double DEFAULT_INTERVAL_WIDTH = 0.95d;
  public static final int DEFAULT_UNCERTAINTY_SAMPLES = 300;

  public ModelConfig {
    Objects.requireNonNull(seasonalityMode, "seasonalityMode");
    Objects.requireNonNull(growth, "growth");
    Objects.requireNonNull(dailySeasonality, "dailySeasonality");
    Objects.requireNonNull(weeklySeasonality, "weeklySeasonality");
    Objects.requireNonNull(yearlySeasonality, "yearlySeasonality");
    if (!(intervalWidth > 0d && intervalWidth < 1d)) {
      throw new IllegalArgumentException("intervalWidth must be in (0, 1)");
    }
    if (uncertaintySamples < 1) {
      throw new IllegalArgumentException("uncertaintySamples must be positive");
    }
  }

  public static ModelConfig defaults() {
    return new ModelConfig(SeasonalityMode.ADDITIVE, Growth.LINEAR, SeasonalityToggle.AUTO,
        SeasonalityToggle.AUTO, SeasonalityToggle.AUTO, DEFAULT_INTERVAL_WIDTH,
        DEFAULT_UNCERTAINTY_SAMPLES, null);
  }

  public Map<String, Object> describe() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("seasonality_mode", lower(seasonalityMode));
    params.put("growth", lower(growth));
    params.put("daily_seasonality", lower(dailySeasonality));
    params.put("weekly_seasonality", lower(weeklySeasonality));
    params.put("yearly_seasonality", lower(yearlySeasonality));
    params.put("interval_width", intervalWidth);
    params.put("uncertainty_samples", uncertaintySamples);
    return params;
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
