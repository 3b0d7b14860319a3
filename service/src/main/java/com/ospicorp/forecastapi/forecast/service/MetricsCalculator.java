package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.MetricsSet;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class MetricsCalculator {
  private MetricsCalculator() {
  }

  /**
   * Accuracy of the historical fit, pairing each actual with the forecast at the same timestamp.
   */
  public static MetricsSet forHistory(List<TimeSeriesPoint> history,
      List<ForecastPoint> forecast) {
    Map<LocalDateTime, Double> fitted = new HashMap<>();
    for (ForecastPoint p : forecast) {
      fitted.put(p.timestamp(), p.estimate());
    }
    double[] actual = new double[history.size()];
    double[] predicted = new double[history.size()];
    int n = 0;
    for (TimeSeriesPoint p : history) {
      Double estimate = fitted.get(p.timestamp());
      if (estimate == null) {
        continue;
      }
      actual[n] = p.value();
      predicted[n] = estimate;
      n++;
    }
    return calculate(Arrays.copyOf(actual, n), Arrays.copyOf(predicted, n));
  }

  public static MetricsSet calculate(double[] actual, double[] predicted) {
    if (actual.length != predicted.length) {
      throw new IllegalArgumentException(
          "actual and predicted differ in length: " + actual.length + " vs " + predicted.length);
    }
    double absSum = 0d;
    double sqSum = 0d;
    double pctSum = 0d;
    int n = 0;
    for (int i = 0; i < actual.length; i++) {
      double a = actual[i];
      double p = predicted[i];
      if (!Double.isFinite(a) || !Double.isFinite(p)) {
        continue;
      }
      double err = a - p;
      absSum += Math.abs(err);
      sqSum += err * err;
      pctSum += Math.abs(err / a);
      n++;
    }
    if (n == 0) {
      return MetricsSet.zero();
    }
    double mape = pctSum / n * 100d;
    // a zero actual makes MAPE undefined; reported as 0.0 rather than Infinity/NaN
    if (!Double.isFinite(mape)) {
      mape = 0d;
    }
    return new MetricsSet(
        round(absSum / n, 4),
        round(Math.sqrt(sqSum / n), 4),
        round(mape, 2));
  }

  // half-even on the decimal value; no long overflow for large magnitudes
  static double round(double value, int places) {
    if (!Double.isFinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
  }
}
