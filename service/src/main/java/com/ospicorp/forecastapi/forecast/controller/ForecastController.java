package com.ospicorp.forecastapi.forecast.controller;

import com.ospicorp.forecastapi.forecast.error.InvalidParameterException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import com.ospicorp.forecastapi.forecast.model.ForecastAnalysis;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastSource;
import com.ospicorp.forecastapi.forecast.model.Growth;
import com.ospicorp.forecastapi.forecast.model.ModelConfig;
import com.ospicorp.forecastapi.forecast.model.SeasonalityMode;
import com.ospicorp.forecastapi.forecast.model.SeasonalityToggle;
import com.ospicorp.forecastapi.forecast.service.ForecastService;
import com.ospicorp.forecastapi.forecast.service.UploadStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/forecast")
@Validated
@Tag(name = "Forecasting")
public class ForecastController {
  static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final String STORED_NAME_REGEX = "^clean_[A-Za-z0-9._-]{1,128}$";
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final ForecastService service;
  private final UploadStore uploads;
  private final int maxHorizonDays;

  public ForecastController(ForecastService service, UploadStore uploads,
      @Value("${forecast.max-horizon-days:3650}") int maxHorizonDays) {
    this.service = service;
    this.uploads = uploads;
    this.maxHorizonDays = maxHorizonDays;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Analyze an uploaded series",
      description = "Normalizes the CSV, forecasts it and reports anomalies, accuracy metrics and insights.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Analysis result",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastAnalysis.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid upload or parameters",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Model could not be fitted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ResponseEntity<Object>> analyze(
      @RequestPart("file") MultipartFile file,
      @RequestParam(defaultValue = "${forecast.default-horizon-days:30}")
          @Parameter(description = "Number of days to forecast", example = "30") String days,
      @RequestParam(name = "seasonality_mode", defaultValue = "additive") String seasonalityMode,
      @RequestParam(defaultValue = "linear") String growth,
      @RequestParam(name = "daily_seasonality", defaultValue = "auto") String dailySeasonality,
      @RequestParam(name = "weekly_seasonality", defaultValue = "auto") String weeklySeasonality,
      @RequestParam(name = "yearly_seasonality", defaultValue = "auto") String yearlySeasonality,
      @RequestParam(required = false) @Parameter(description = "json or csv") String format) {

    ForecastRequest request = parseRequest(days, seasonalityMode, growth, dailySeasonality,
        weeklySeasonality, yearlySeasonality);
    MediaType contentType = selectMediaType(format);

    DataTable normalized = service.ingest(file.getOriginalFilename(), readUpload(file));
    return service.analyzeAsync(ForecastSource.loaded(normalized), request)
        .thenApply(result -> respond(result, contentType));
  }

  @PostMapping("/uploads/{fileName}")
  @Operation(summary = "Re-analyze a stored upload",
      description = "Runs the analysis again on a normalized upload kept by the service.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Analysis result",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ForecastAnalysis.class))),
      @ApiResponse(responseCode = "400", description = "Unknown upload or invalid parameters",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ResponseEntity<Object>> reanalyze(
      @PathVariable @Pattern(regexp = STORED_NAME_REGEX)
          @Parameter(description = "Stored upload name", example = "clean_sales.csv") String fileName,
      @RequestParam(defaultValue = "${forecast.default-horizon-days:30}") String days,
      @RequestParam(name = "seasonality_mode", defaultValue = "additive") String seasonalityMode,
      @RequestParam(defaultValue = "linear") String growth,
      @RequestParam(name = "daily_seasonality", defaultValue = "auto") String dailySeasonality,
      @RequestParam(name = "weekly_seasonality", defaultValue = "auto") String weeklySeasonality,
      @RequestParam(name = "yearly_seasonality", defaultValue = "auto") String yearlySeasonality,
      @RequestParam(required = false) String format) {

    ForecastRequest request = parseRequest(days, seasonalityMode, growth, dailySeasonality,
        weeklySeasonality, yearlySeasonality);
    MediaType contentType = selectMediaType(format);
    ForecastSource source = ForecastSource.stored(uploads.resolve(fileName));
    return service.analyzeAsync(source, request)
        .thenApply(result -> respond(result, contentType));
  }

  private ForecastRequest parseRequest(String daysParam, String seasonalityMode, String growth,
      String daily, String weekly, String yearly) {
    int days = parseDays(daysParam);
    ModelConfig config = service.modelConfig(
        parseEnum(SeasonalityMode.class, "seasonality_mode", seasonalityMode,
            "Invalid seasonality_mode. Supported values: additive,multiplicative.", 1002),
        parseEnum(Growth.class, "growth", growth,
            "Invalid growth. Supported values: linear,flat.", 1003),
        parseToggle("daily_seasonality", daily, 1004),
        parseToggle("weekly_seasonality", weekly, 1005),
        parseToggle("yearly_seasonality", yearly, 1006));
    return new ForecastRequest(days, config);
  }

  private int parseDays(String value) {
    String message = "Invalid days parameter. Supported range: 0-" + maxHorizonDays + ".";
    int days;
    try {
      days = Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw invalidParameter("days", message, 1001);
    }
    if (days < 0 || days > maxHorizonDays) {
      throw invalidParameter("days", message, 1001);
    }
    return days;
  }

  private static SeasonalityToggle parseToggle(String name, String value, int errorCode) {
    return parseEnum(SeasonalityToggle.class, name, value,
        "Invalid " + name + ". Supported values: auto,true,false.", errorCode);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value,
      String message, int errorCode) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter(name, message, errorCode);
    }
  }

  private static MediaType selectMediaType(String format) {
    if (!StringUtils.hasText(format) || "json".equalsIgnoreCase(format)) {
      return MediaType.APPLICATION_JSON;
    }
    if ("csv".equalsIgnoreCase(format)) {
      return CSV_MEDIA_TYPE;
    }
    throw invalidParameter("format", "Invalid format value. Supported values: json,csv.", 1007);
  }

  private static ResponseEntity<Object> respond(ForecastAnalysis result, MediaType contentType) {
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? result.forecast() : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static byte[] readUpload(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not read uploaded file", ex);
    }
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
