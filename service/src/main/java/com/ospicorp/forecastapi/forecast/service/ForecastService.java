package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.error.ForecastException;
import com.ospicorp.forecastapi.forecast.error.InternalAnalysisException;
import com.ospicorp.forecastapi.forecast.model.Anomaly;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import com.ospicorp.forecastapi.forecast.model.ForecastAnalysis;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastRun;
import com.ospicorp.forecastapi.forecast.model.ForecastSource;
import com.ospicorp.forecastapi.forecast.model.Growth;
import com.ospicorp.forecastapi.forecast.model.InsightSet;
import com.ospicorp.forecastapi.forecast.model.MetricsSet;
import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.SeasonalityMode;
import com.ospicorp.forecastapi.forecast.model.SeasonalityToggle;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs the analysis pipeline: normalize, fit/predict, then anomalies, metrics and insights.
 */
@Service
public class ForecastService {
  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final ForecastOrchestrator orchestrator;
  private final CsvTableReader csv;
  private final UploadStore uploads;
  private final double intervalWidth;
  private final int uncertaintySamples;
  private final Long randomSeed;

  public ForecastService(ForecastOrchestrator orchestrator, CsvTableReader csv,
      UploadStore uploads,
      @Value("${forecast.model.interval-width:0.95}") double intervalWidth,
      @Value("${forecast.model.uncertainty-samples:300}") int uncertaintySamples,
      @Value("${forecast.model.random-seed:#{null}}") Long randomSeed) {
    this.orchestrator = orchestrator;
    this.csv = csv;
    this.uploads = uploads;
    this.intervalWidth = intervalWidth;
    this.uncertaintySamples = uncertaintySamples;
    this.randomSeed = randomSeed;
  }

  public ModelConfig modelConfig(SeasonalityMode mode, Growth growth, SeasonalityToggle daily,
      SeasonalityToggle weekly, SeasonalityToggle yearly) {
    return new ModelConfig(mode, growth, daily, weekly, yearly, intervalWidth,
        uncertaintySamples, randomSeed);
  }

  /**
   * Parses and normalizes an uploaded CSV and keeps a copy in the upload store.
   */
  public DataTable ingest(String filename, byte[] content) {
    DataTable normalized = ColumnNormalizer.normalize(csv.read(content));
    uploads.store(filename, normalized);
    return normalized;
  }

  @Async("forecastExecutor")
  public CompletableFuture<ForecastAnalysis> analyzeAsync(ForecastSource source,
      ForecastRequest request) {
    return CompletableFuture.completedFuture(analyze(source, request));
  }

  public ForecastAnalysis analyze(ForecastSource source, ForecastRequest request) {
    long started = System.currentTimeMillis();
    DataTable normalized = ColumnNormalizer.normalize(load(source));
    log.info("Analyzing {} rows, horizon {} days", normalized.rowCount(), request.horizonDays());

    ForecastRun run = orchestrator.forecast(normalized, request);

    List<Anomaly> anomalies;
    MetricsSet metrics;
    InsightSet insights;
    try {
      anomalies = AnomalyDetector.detect(run.forecast(), run.history());
      metrics = MetricsCalculator.forHistory(run.history(), run.forecast());
      insights = InsightGenerator.generate(run.history(), run.forecast(), anomalies);
    } catch (ForecastException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new InternalAnalysisException("Analysis failed after forecasting: " + ex.getMessage(),
          ex);
    }

    log.info("Analysis finished in {} ms: {} forecast points, {} anomalies, MAE={}",
        System.currentTimeMillis() - started, run.forecast().size(), anomalies.size(),
        metrics.mae());
    return new ForecastAnalysis(
        "Analysis complete. Forecasted " + request.horizonDays() + " days.",
        normalized.rowCount(),
        request.describe(),
        metrics,
        anomalies,
        insights.insights(),
        insights.recommendations(),
        run.forecast());
  }

  private DataTable load(ForecastSource source) {
    if (source instanceof ForecastSource.StoredTable stored) {
      return csv.read(stored.path());
    }
    return ((ForecastSource.LoadedTable) source).table();
  }
}
