package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.Anomaly;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.InsightSet;
import com.ospicorp.forecastapi.forecast.model.SeverityLevel;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based narrative over a forecast run. Rules always run in this order: trend, peak,
 * anomaly summary, confidence. Consumers rely on the trend insight being first. History and
 * forecast are expected in ascending timestamp order, as {@code ForecastRun} holds them.
 */
public final class InsightGenerator {
  static final double SIGNIFICANT_TREND_PCT = 10d;
  static final double MODERATE_TREND_PCT = 3d;
  static final double HIGH_CONFIDENCE_SPREAD_PCT = 15d;

  private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

  private InsightGenerator() {
  }

  public static InsightSet generate(List<TimeSeriesPoint> history, List<ForecastPoint> forecast,
      List<Anomaly> anomalies) {
    if (history.isEmpty() || forecast.isEmpty()) {
      throw new IllegalArgumentException("history and forecast must not be empty");
    }
    // both lists are in timestamp order; among rows sharing the latest timestamp the last wins
    TimeSeriesPoint lastActual = history.get(history.size() - 1);
    ForecastPoint lastForecast = forecast.get(forecast.size() - 1);

    List<String> insights = new ArrayList<>();
    List<String> recommendations = new ArrayList<>();
    trend(lastActual, lastForecast, insights, recommendations);
    peak(forecast, lastActual.timestamp(), insights, recommendations);
    anomalySummary(anomalies, insights, recommendations);
    confidence(lastForecast, insights, recommendations);
    return new InsightSet(insights, recommendations);
  }

  private static void trend(TimeSeriesPoint lastActual, ForecastPoint lastForecast,
      List<String> insights, List<String> recommendations) {
    double trendPct = (lastForecast.estimate() - lastActual.value()) / lastActual.value() * 100d;
    if (!Double.isFinite(trendPct)) {
      trendPct = 0d;
    }
    boolean growth = trendPct > 0d;
    String direction = growth ? "growth" : "decline";
    double magnitude = Math.abs(trendPct);
    String intensity = magnitude > SIGNIFICANT_TREND_PCT ? "Significant"
        : magnitude > MODERATE_TREND_PCT ? "Moderate" : "Minimal";

    insights.add(String.format(Locale.ROOT,
        "<b>%s %s</b>: Expect a %.1f%% %s in values over the next forecast cycle.",
        intensity, growth ? "Growth" : "Decline", magnitude, direction));

    if (!growth) {
      recommendations.add("<b>Cost Optimization</b>: Identify potential operational "
          + "efficiencies to offset the projected decline.");
    } else if (magnitude > SIGNIFICANT_TREND_PCT) {
      recommendations.add("<b>Scale Operations</b>: Increase capacity and inventory to meet "
          + "projected high demand.");
    } else {
      recommendations.add("<b>Monitor Steady Growth</b>: Continue current growth strategies "
          + "with regular performance checks.");
    }
  }

  private static void peak(List<ForecastPoint> forecast, LocalDateTime lastHistorical,
      List<String> insights, List<String> recommendations) {
    ForecastPoint peak = null;
    for (ForecastPoint p : forecast) {
      if (!p.timestamp().isAfter(lastHistorical)) {
        continue;
      }
      if (peak == null || p.estimate() > peak.estimate()) {
        peak = p;
      }
    }
    if (peak == null) {
      return;
    }
    String day = DAY.format(peak.timestamp());
    insights.add(String.format(Locale.ROOT,
        "<b>Forecast Peak</b>: The model projects a high of <b>%.2f</b> around <b>%s</b>.",
        peak.estimate(), day));
    recommendations.add("<b>Peak Readiness</b>: Plan marketing or maintenance activities around "
        + "the <b>" + day + "</b> peak.");
  }

  private static void anomalySummary(List<Anomaly> anomalies, List<String> insights,
      List<String> recommendations) {
    if (anomalies.isEmpty()) {
      insights.add("<b>Operational Stability</b>: No significant anomalies detected in recent "
          + "historical data.");
      return;
    }
    long high = anomalies.stream()
        .filter(a -> a.severityLevel() == SeverityLevel.HIGH)
        .count();
    if (high > 0) {
      insights.add("<b>Critical Volatility</b>: Detected " + high
          + " <b>High Severity</b> anomalies requiring immediate review.");
      recommendations.add("<b>Risk Mitigation</b>: Audit the high-severity data points to "
          + "identify root causes and prevent recurrence.");
    }
    insights.add("<b>Statistical Stability</b>: Over " + anomalies.size()
        + " historical anomalies identified, helping refine model sensitivity.");
  }

  private static void confidence(ForecastPoint last, List<String> insights,
      List<String> recommendations) {
    double spreadPct = (last.upper() - last.lower()) / last.estimate() * 100d;
    // NaN and infinite spreads fail the comparison and land in the variable branch
    if (spreadPct < HIGH_CONFIDENCE_SPREAD_PCT) {
      insights.add("<b>High Confidence</b>: The model shows high convergence with a narrow "
          + "prediction interval.");
    } else {
      insights.add("<b>Variable Forecast</b>: Noted a wider uncertainty margin, suggesting "
          + "potential external market influence.");
      recommendations.add("<b>Data Refinement</b>: Consider adding additional context columns "
          + "(holidays, promos) to reduce forecast variance.");
    }
  }
}
