package com.ospicorp.forecastapi.forecast.engine;

import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.ModelException;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.Growth;
import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.SeasonalityMode;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Least-squares model with a linear (or flat) trend and Fourier seasonality terms.
 *
 * <p>Bounds come from the predictive standard deviation {@code sigma * sqrt(1 + x'(X'X)^-1 x)}
 * scaled by empirical quantiles of {@code uncertaintySamples} standard normal draws. Passing a
 * random seed in the config makes the bounds reproducible.
 */
@Component
public class RegressionForecastingModel implements ForecastingModel {
  private static final Logger log = LoggerFactory.getLogger(RegressionForecastingModel.class);

  private static final int MIN_POINTS = 2;
  private static final double QR_THRESHOLD = 1e-10;
  private static final double CONSTANT_COLUMN_TOLERANCE = 1e-9;
  private static final double NOISE_FLOOR_RATIO = 1e-6;

  @Override
  public TrainedModel fit(List<TimeSeriesPoint> history, ModelConfig config) {
    List<TimeSeriesPoint> usable = new ArrayList<>(history.size());
    for (TimeSeriesPoint p : history) {
      if (Double.isFinite(p.value())) {
        usable.add(p);
      }
    }
    if (usable.size() < MIN_POINTS) {
      throw new ModelException(ErrorKind.INSUFFICIENT_DATA,
          "Series has less than " + MIN_POINTS + " usable rows.");
    }

    Design full = Design.create(usable, config);
    double[][] rawRows = new double[usable.size()][];
    double[] y = new double[usable.size()];
    double maxAbs = 0d;
    for (int i = 0; i < usable.size(); i++) {
      rawRows[i] = full.row(usable.get(i).timestamp());
      y[i] = usable.get(i).value();
      maxAbs = Math.max(maxAbs, Math.abs(y[i]));
    }
    int[] kept = varyingColumns(rawRows);
    if (usable.size() <= kept.length) {
      throw new ModelException(ErrorKind.INSUFFICIENT_DATA,
          "Need more than " + kept.length + " rows to fit " + kept.length
              + " model terms, got " + usable.size() + ".");
    }
    double[][] x = new double[rawRows.length][];
    for (int i = 0; i < rawRows.length; i++) {
      x[i] = project(rawRows[i], kept);
    }

    OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(QR_THRESHOLD);
    ols.setNoIntercept(true);
    double[] beta;
    double[][] covariance;
    double sigma;
    try {
      ols.newSampleData(y, x);
      beta = ols.estimateRegressionParameters();
      covariance = ols.estimateRegressionParametersVariance();
      sigma = Math.sqrt(Math.max(ols.estimateErrorVariance(), 0d));
    } catch (SingularMatrixException ex) {
      throw new ModelException(ErrorKind.MODEL_FAILURE,
          "Model terms are collinear for this series; check the seasonality settings", ex);
    } catch (MathIllegalArgumentException ex) {
      throw new ModelException(ErrorKind.INSUFFICIENT_DATA,
          "Not enough data to fit the model: " + ex.getMessage(), ex);
    }
    sigma = Math.max(sigma, NOISE_FLOOR_RATIO * maxAbs);

    log.debug("Fitted {} terms ({} seasonalities) on {} points, sigma={}",
        kept.length, full.seasonalities().size(), usable.size(), sigma);
    return new Fitted(config, full, kept, beta, covariance, sigma);
  }

  @Override
  public List<ForecastPoint> predict(TrainedModel model, List<LocalDateTime> timestamps) {
    if (!(model instanceof Fitted fitted)) {
      throw new IllegalArgumentException(
          "Model was not produced by " + getClass().getSimpleName());
    }
    ModelConfig config = fitted.config();
    double[] quantiles = standardNormalQuantiles(config);

    List<ForecastPoint> out = new ArrayList<>(timestamps.size());
    for (LocalDateTime ts : timestamps) {
      double[] x = project(fitted.design().row(ts), fitted.kept());
      double estimate = dot(x, fitted.beta());
      double leverage = quadraticForm(x, fitted.covariance());
      double sd = fitted.sigma() * Math.sqrt(1d + Math.max(leverage, 0d));
      out.add(new ForecastPoint(ts, estimate, estimate + sd * quantiles[0],
          estimate + sd * quantiles[1]));
    }
    return out;
  }

  private static double[] standardNormalQuantiles(ModelConfig config) {
    RandomGenerator rng = config.randomSeed() != null
        ? new Well19937c(config.randomSeed())
        : new Well19937c();
    double[] draws = new double[config.uncertaintySamples()];
    for (int i = 0; i < draws.length; i++) {
      draws[i] = rng.nextGaussian();
    }
    double tail = (1d - config.intervalWidth()) / 2d * 100d;
    Percentile percentile = new Percentile();
    percentile.setData(draws);
    double low = percentile.evaluate(Math.max(tail, Double.MIN_VALUE));
    double high = percentile.evaluate(100d - tail);
    // keeps lower <= estimate <= upper even for tiny sample counts
    return new double[] {Math.min(low, 0d), Math.max(high, 0d)};
  }

  private static int[] varyingColumns(double[][] rows) {
    int width = rows[0].length;
    List<Integer> kept = new ArrayList<>(width);
    kept.add(0);
    for (int c = 1; c < width; c++) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (double[] row : rows) {
        min = Math.min(min, row[c]);
        max = Math.max(max, row[c]);
      }
      if (max - min > CONSTANT_COLUMN_TOLERANCE) {
        kept.add(c);
      }
    }
    return kept.stream().mapToInt(Integer::intValue).toArray();
  }

  private static double[] project(double[] row, int[] kept) {
    double[] out = new double[kept.length];
    for (int i = 0; i < kept.length; i++) {
      out[i] = row[kept[i]];
    }
    return out;
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0d;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  private static double quadraticForm(double[] x, double[][] m) {
    double sum = 0d;
    for (int i = 0; i < x.length; i++) {
      sum += x[i] * dot(m[i], x);
    }
    return sum;
  }

  /**
   * Column layout: intercept, trend (linear growth only), seasonal terms, and for
   * multiplicative mode with linear growth the seasonal terms scaled by the trend.
   */
  record Design(double start, double span, boolean trend, boolean multiplicative,
      List<Seasonality> seasonalities) {

    static Design create(List<TimeSeriesPoint> history, ModelConfig config) {
      double start = TimeScale.epochDays(history.get(0).timestamp());
      double end = TimeScale.epochDays(history.get(history.size() - 1).timestamp());
      double span = end > start ? end - start : 1d;
      boolean trend = config.growth() == Growth.LINEAR;
      boolean multiplicative = trend
          && config.seasonalityMode() == SeasonalityMode.MULTIPLICATIVE;
      return new Design(start, span, trend, multiplicative,
          List.copyOf(Seasonality.enabled(config, history)));
    }

    int width() {
      int seasonal = seasonalities.stream().mapToInt(Seasonality::columns).sum();
      return 1 + (trend ? 1 : 0) + seasonal * (multiplicative ? 2 : 1);
    }

    double[] row(LocalDateTime ts) {
      double days = TimeScale.epochDays(ts);
      double[] row = new double[width()];
      row[0] = 1d;
      int offset = 1;
      double t = (days - start) / span;
      if (trend) {
        row[offset++] = t;
      }
      int seasonalStart = offset;
      for (Seasonality s : seasonalities) {
        s.fill(days, row, offset);
        offset += s.columns();
      }
      if (multiplicative) {
        int seasonalEnd = offset;
        for (int c = seasonalStart; c < seasonalEnd; c++) {
          row[offset++] = row[c] * t;
        }
      }
      return row;
    }
  }

  private record Fitted(ModelConfig config, Design design, int[] kept, double[] beta,
      double[][] covariance, double sigma) implements TrainedModel {}
}
