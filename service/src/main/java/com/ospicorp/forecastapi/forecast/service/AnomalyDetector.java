package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.Anomaly;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.SeverityLevel;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class AnomalyDetector {
  static final double HIGH_THRESHOLD_PCT = 20d;
  static final double MEDIUM_THRESHOLD_PCT = 10d;

  private AnomalyDetector() {
  }

  /**
   * Flags historical points outside their predicted interval. Points with no forecast at the
   * same timestamp are skipped.
   */
  public static List<Anomaly> detect(List<ForecastPoint> forecast, List<TimeSeriesPoint> actuals) {
    Map<LocalDateTime, ForecastPoint> byTimestamp = new HashMap<>();
    for (ForecastPoint p : forecast) {
      byTimestamp.put(p.timestamp(), p);
    }

    List<Anomaly> out = new ArrayList<>();
    for (TimeSeriesPoint actual : actuals) {
      ForecastPoint predicted = byTimestamp.get(actual.timestamp());
      if (predicted == null) {
        continue;
      }
      double y = actual.value();
      if (!(y < predicted.lower() || y > predicted.upper())) {
        continue;
      }
      double deviation = Math.abs(y - predicted.estimate());
      out.add(new Anomaly(actual.timestamp(), y, predicted.estimate(), predicted.lower(),
          predicted.upper(), deviation, classify(deviation, predicted.estimate())));
    }
    out.sort(Comparator.comparing(Anomaly::timestamp));
    return out;
  }

  static SeverityLevel classify(double deviation, double estimate) {
    // relative deviation is unbounded around a zero estimate
    if (estimate == 0d) {
      return SeverityLevel.HIGH;
    }
    return levelForPercent(deviation / estimate * 100d);
  }

  static SeverityLevel levelForPercent(double pct) {
    if (pct > HIGH_THRESHOLD_PCT) return SeverityLevel.HIGH;
    if (pct > MEDIUM_THRESHOLD_PCT) return SeverityLevel.MEDIUM;
    return SeverityLevel.LOW;
  }
}
