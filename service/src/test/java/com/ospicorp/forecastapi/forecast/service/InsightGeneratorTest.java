package com.ospicorp.forecastapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.forecastapi.forecast.model.Anomaly;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.SeverityLevel;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class InsightGeneratorTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 0, 0);

  private static List<TimeSeriesPoint> history(double last) {
    return List.of(new TimeSeriesPoint(T0, 90), new TimeSeriesPoint(T0.plusDays(1), last));
  }

  private static ForecastPoint point(int day, double estimate, double halfWidth) {
    return new ForecastPoint(T0.plusDays(day), estimate, estimate - halfWidth,
        estimate + halfWidth);
  }

  private static Anomaly anomaly(SeverityLevel level) {
    return new Anomaly(T0, 150, 100, 95, 105, 50, level);
  }

  @Test
  void strongGrowthWithHighAnomaliesProducesAllRulesInOrder() {
    var forecast = List.of(point(0, 90, 1), point(1, 100, 1), point(2, 130, 1),
        point(3, 120, 1));

    var out = InsightGenerator.generate(history(100), forecast,
        List.of(anomaly(SeverityLevel.HIGH), anomaly(SeverityLevel.LOW)));

    assertEquals(5, out.insights().size());
    assertEquals("<b>Significant Growth</b>: Expect a 20.0% growth in values over the next "
        + "forecast cycle.", out.insights().get(0));
    assertEquals("<b>Forecast Peak</b>: The model projects a high of <b>130.00</b> around "
        + "<b>2024-03-03</b>.", out.insights().get(1));
    assertTrue(out.insights().get(2).startsWith("<b>Critical Volatility</b>: Detected 1 "));
    assertTrue(out.insights().get(3).startsWith("<b>Statistical Stability</b>: Over 2 "));
    assertTrue(out.insights().get(4).startsWith("<b>High Confidence</b>"));

    assertEquals(3, out.recommendations().size());
    assertTrue(out.recommendations().get(0).startsWith("<b>Scale Operations</b>"));
    assertTrue(out.recommendations().get(1).contains("<b>2024-03-03</b> peak"));
    assertTrue(out.recommendations().get(2).startsWith("<b>Risk Mitigation</b>"));
  }

  @Test
  void moderateGrowthRecommendsMonitoring() {
    var out = InsightGenerator.generate(history(100), List.of(point(2, 105, 1)), List.of());

    assertTrue(out.insights().get(0).startsWith("<b>Moderate Growth</b>: Expect a 5.0% growth"));
    assertTrue(out.recommendations().get(0).startsWith("<b>Monitor Steady Growth</b>"));
  }

  @Test
  void declineRecommendsCostOptimization() {
    var out = InsightGenerator.generate(history(100), List.of(point(2, 98, 1)), List.of());

    assertTrue(out.insights().get(0).startsWith("<b>Minimal Decline</b>: Expect a 2.0% decline"));
    assertTrue(out.recommendations().get(0).startsWith("<b>Cost Optimization</b>"));
  }

  @Test
  void zeroLastActualReportsMinimalDecline() {
    var out = InsightGenerator.generate(history(0), List.of(point(2, 5, 0.1)), List.of());

    assertTrue(out.insights().get(0).startsWith("<b>Minimal Decline</b>: Expect a 0.0% decline"));
  }

  @Test
  void trendComparesAgainstTheLastOfRowsSharingTheLatestTimestamp() {
    var history = List.of(
        new TimeSeriesPoint(T0, 90),
        new TimeSeriesPoint(T0.plusDays(1), 200),
        new TimeSeriesPoint(T0.plusDays(1), 100));

    var out = InsightGenerator.generate(history, List.of(point(2, 105, 1)), List.of());

    assertTrue(out.insights().get(0).startsWith("<b>Moderate Growth</b>: Expect a 5.0% growth"));
  }

  @Test
  void noFutureRowsSkipsThePeakRule() {
    var forecast = List.of(point(0, 90, 1), point(1, 100, 1));

    var out = InsightGenerator.generate(history(100), forecast, List.of());

    assertEquals(3, out.insights().size());
    assertTrue(out.insights().get(1).startsWith("<b>Operational Stability</b>"));
    assertEquals(1, out.recommendations().size());
  }

  @Test
  void peakTakesTheFirstOfTiedMaxima() {
    var forecast = List.of(point(2, 120, 1), point(3, 120, 1), point(4, 110, 1));

    var out = InsightGenerator.generate(history(100), forecast, List.of());

    assertTrue(out.insights().get(1).contains("<b>2024-03-03</b>"));
  }

  @Test
  void lowSeverityAnomaliesOnlyAddTheStabilitySummary() {
    var out = InsightGenerator.generate(history(100), List.of(point(2, 101, 1)),
        List.of(anomaly(SeverityLevel.MEDIUM)));

    assertTrue(out.insights().get(2).startsWith("<b>Statistical Stability</b>: Over 1 "));
    assertTrue(out.recommendations().stream().noneMatch(r -> r.contains("Risk Mitigation")));
  }

  @Test
  void wideIntervalIsAVariableForecast() {
    var out = InsightGenerator.generate(history(100), List.of(point(2, 100, 10)), List.of());

    var insights = out.insights();
    assertTrue(insights.get(insights.size() - 1).startsWith("<b>Variable Forecast</b>"));
    var recs = out.recommendations();
    assertTrue(recs.get(recs.size() - 1).startsWith("<b>Data Refinement</b>"));
  }

  @Test
  void emptyInputsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> InsightGenerator.generate(List.of(), List.of(point(0, 1, 1)), List.of()));
    assertThrows(IllegalArgumentException.class,
        () -> InsightGenerator.generate(history(1), List.of(), List.of()));
  }
}
