package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.engine.ForecastingModel;
import com.ospicorp.forecastapi.forecast.engine.TrainedModel;
import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.ForecastException;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.error.ModelException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastRun;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ForecastOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(ForecastOrchestrator.class);

  private final ForecastingModel model;

  public ForecastOrchestrator(ForecastingModel model) {
    this.model = model;
  }

  public ForecastRun forecast(DataTable normalized, ForecastRequest request) {
    if (request.horizonDays() < 0) {
      throw new InputException(ErrorKind.INVALID_HORIZON, "Forecast horizon must be >= 0 days");
    }
    List<TimeSeriesPoint> history = toHistory(normalized);

    TreeSet<LocalDateTime> timestamps = new TreeSet<>();
    history.forEach(p -> timestamps.add(p.timestamp()));
    if (!history.isEmpty()) {
      LocalDateTime last = history.get(history.size() - 1).timestamp();
      for (int day = 1; day <= request.horizonDays(); day++) {
        timestamps.add(last.plusDays(day));
      }
    }

    log.debug("Fitting {} on {} points, predicting {} timestamps",
        model.getClass().getSimpleName(), history.size(), timestamps.size());
    List<ForecastPoint> forecast;
    try {
      TrainedModel trained = model.fit(history, request.modelConfig());
      forecast = new ArrayList<>(model.predict(trained, new ArrayList<>(timestamps)));
    } catch (ForecastException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new ModelException(ErrorKind.MODEL_FAILURE,
          "Forecasting model failed: " + ex.getMessage(), ex);
    }
    forecast.sort(Comparator.comparing(ForecastPoint::timestamp));
    return new ForecastRun(history, forecast);
  }

  static List<TimeSeriesPoint> toHistory(DataTable normalized) {
    if (normalized.indexOf(ColumnNormalizer.DATE_COLUMN) < 0
        || normalized.indexOf(ColumnNormalizer.VALUE_COLUMN) < 0) {
      throw new InputException(ErrorKind.UNREADABLE_TABLE,
          "Input table must contain 'ds' and 'y' columns.");
    }
    List<LocalDateTime> stamps =
        TimestampParser.parseAll(normalized.column(ColumnNormalizer.DATE_COLUMN));
    List<String> values = normalized.column(ColumnNormalizer.VALUE_COLUMN);

    List<TimeSeriesPoint> history = new ArrayList<>(stamps.size());
    for (int i = 0; i < stamps.size(); i++) {
      Double value = ColumnNormalizer.parseNumber(values.get(i));
      if (value == null) {
        throw new InputException(ErrorKind.UNREADABLE_TABLE,
            "Value in row " + (i + 1) + " is not numeric: '" + values.get(i) + "'");
      }
      history.add(new TimeSeriesPoint(stamps.get(i), value));
    }
    // List.sort is stable, rows sharing a timestamp keep their input order
    history.sort(Comparator.comparing(TimeSeriesPoint::timestamp));
    return history;
  }
}
