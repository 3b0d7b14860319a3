package com.ospicorp.forecastapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.forecastapi.forecast.engine.ForecastingModel;
import com.ospicorp.forecastapi.forecast.engine.TrainedModel;
import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.error.ModelException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecastOrchestratorTest {

  /** Echoes a constant estimate for every requested timestamp, newest first. */
  static class RecordingModel implements ForecastingModel {
    List<TimeSeriesPoint> fitted;
    List<LocalDateTime> requested;
    RuntimeException failure;

    @Override
    public TrainedModel fit(List<TimeSeriesPoint> history, ModelConfig config) {
      if (failure != null) {
        throw failure;
      }
      fitted = history;
      return () -> config;
    }

    @Override
    public List<ForecastPoint> predict(TrainedModel model, List<LocalDateTime> timestamps) {
      requested = timestamps;
      List<ForecastPoint> out = new ArrayList<>();
      for (LocalDateTime ts : timestamps) {
        out.add(new ForecastPoint(ts, 10d, 9d, 11d));
      }
      Collections.reverse(out);
      return out;
    }
  }

  private static DataTable table(String[]... rows) {
    return DataTable.of(List.of("ds", "y"), rows);
  }

  private static ForecastRequest horizon(int days) {
    return new ForecastRequest(days, ModelConfig.defaults());
  }

  @Test
  void requestsHistoryPlusDailyHorizonAndSortsOutput() {
    var model = new RecordingModel();
    var run = new ForecastOrchestrator(model).forecast(table(
        new String[] {"2024-01-03", "3"},
        new String[] {"2024-01-01", "1"},
        new String[] {"2024-01-02", "2"}), horizon(2));

    assertEquals(List.of(1d, 2d, 3d), model.fitted.stream().map(TimeSeriesPoint::value).toList());
    assertEquals(5, model.requested.size());
    assertEquals(LocalDateTime.of(2024, 1, 5, 0, 0), model.requested.get(4));

    assertEquals(5, run.forecast().size());
    assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), run.forecast().get(0).timestamp());
    assertEquals(LocalDateTime.of(2024, 1, 5, 0, 0), run.forecast().get(4).timestamp());
  }

  @Test
  void futureStepsFollowTheLastTimestampsTimeOfDay() {
    var model = new RecordingModel();
    new ForecastOrchestrator(model).forecast(table(
        new String[] {"2024-01-01T08:30:00+01:00", "1"},
        new String[] {"2024-01-02T08:30:00+01:00", "2"}), horizon(1));

    assertEquals(LocalDateTime.of(2024, 1, 3, 8, 30), model.requested.get(2));
  }

  @Test
  void zeroHorizonPredictsHistoryOnly() {
    var model = new RecordingModel();
    var run = new ForecastOrchestrator(model).forecast(table(
        new String[] {"2024-01-01", "1"},
        new String[] {"2024-01-02", "2"}), horizon(0));

    assertEquals(2, run.forecast().size());
  }

  @Test
  void duplicateTimestampsAreKeptInHistoryButPredictedOnce() {
    var model = new RecordingModel();
    var run = new ForecastOrchestrator(model).forecast(table(
        new String[] {"2024-01-01", "1"},
        new String[] {"2024-01-01", "5"},
        new String[] {"2024-01-02", "2"}), horizon(0));

    assertEquals(List.of(1d, 5d, 2d), run.history().stream().map(TimeSeriesPoint::value).toList());
    assertEquals(2, model.requested.size());
  }

  @Test
  void badTimestampFailsBeforeFitting() {
    var model = new RecordingModel();
    var ex = assertThrows(InputException.class, () -> new ForecastOrchestrator(model).forecast(
        table(new String[] {"yesterday", "1"}), horizon(1)));

    assertEquals(ErrorKind.DATE_PARSE_FAILURE, ex.kind());
    assertNull(model.fitted);
  }

  @Test
  void negativeHorizonIsRejected() {
    var ex = assertThrows(InputException.class,
        () -> new ForecastOrchestrator(new RecordingModel()).forecast(
            table(new String[] {"2024-01-01", "1"}), horizon(-1)));
    assertEquals(ErrorKind.INVALID_HORIZON, ex.kind());
  }

  @Test
  void unexpectedModelErrorsAreWrapped() {
    var model = new RecordingModel();
    model.failure = new IllegalStateException("boom");

    var ex = assertThrows(ModelException.class, () -> new ForecastOrchestrator(model).forecast(
        table(new String[] {"2024-01-01", "1"}), horizon(1)));
    assertEquals(ErrorKind.MODEL_FAILURE, ex.kind());
    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }

  @Test
  void modelErrorsPassThroughUnchanged() {
    var model = new RecordingModel();
    var original = new ModelException(ErrorKind.INSUFFICIENT_DATA, "too short");
    model.failure = original;

    var ex = assertThrows(ModelException.class, () -> new ForecastOrchestrator(model).forecast(
        table(new String[] {"2024-01-01", "1"}), horizon(1)));
    assertSame(original, ex);
  }
}
