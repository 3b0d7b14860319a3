package com.ospicorp.forecastapi.forecast.engine;

import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.SeasonalityToggle;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.List;

/** Fourier seasonality components, periods in days. */
enum Seasonality {
  DAILY(1d, 4),
  WEEKLY(7d, 3),
  YEARLY(365.25d, 10);

  private final double period;
  private final int order;

  Seasonality(double period, int order) {
    this.period = period;
    this.order = order;
  }

  int columns() {
    return 2 * order;
  }

  void fill(double epochDays, double[] row, int offset) {
    for (int k = 1; k <= order; k++) {
      double angle = 2d * Math.PI * k * epochDays / period;
      row[offset + 2 * (k - 1)] = Math.sin(angle);
      row[offset + 2 * (k - 1) + 1] = Math.cos(angle);
    }
  }

  static List<Seasonality> enabled(ModelConfig config, List<TimeSeriesPoint> history) {
    double span = spanDays(history);
    double spacing = minSpacingDays(history);
    List<Seasonality> out = new ArrayList<>(3);
    if (decide(config.yearlySeasonality(), span >= 730d)) {
      out.add(YEARLY);
    }
    if (decide(config.weeklySeasonality(), span >= 14d && spacing < 7d)) {
      out.add(WEEKLY);
    }
    if (decide(config.dailySeasonality(), span >= 2d && spacing < 1d)) {
      out.add(DAILY);
    }
    return out;
  }

  private static boolean decide(SeasonalityToggle toggle, boolean auto) {
    return switch (toggle) {
      case TRUE -> true;
      case FALSE -> false;
      case AUTO -> auto;
    };
  }

  private static double spanDays(List<TimeSeriesPoint> history) {
    if (history.size() < 2) {
      return 0d;
    }
    return TimeScale.epochDays(history.get(history.size() - 1).timestamp())
        - TimeScale.epochDays(history.get(0).timestamp());
  }

  private static double minSpacingDays(List<TimeSeriesPoint> history) {
    double min = Double.POSITIVE_INFINITY;
    for (int i = 1; i < history.size(); i++) {
      double gap = TimeScale.epochDays(history.get(i).timestamp())
          - TimeScale.epochDays(history.get(i - 1).timestamp());
      if (gap > 0d && gap < min) {
        min = gap;
      }
    }
    return min;
  }
}
