package com.ospicorp.forecastapi.forecast.engine;

import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fit/predict capability the pipeline drives. Implementations must not keep per-request state
 * outside the returned {@link TrainedModel}.
 */
public interface ForecastingModel {

  /**
   * @param history points in ascending timestamp order
   * @throws com.ospicorp.forecastapi.forecast.error.ModelException when the model cannot be fitted
   */
  TrainedModel fit(List<TimeSeriesPoint> history, ModelConfig config);

  /**
   * Returns one point per requested timestamp, with bounds at the configured interval width.
   */
  List<ForecastPoint> predict(TrainedModel model, List<LocalDateTime> timestamps);
}
