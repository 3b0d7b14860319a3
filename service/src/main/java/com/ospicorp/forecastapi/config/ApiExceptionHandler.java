package com.ospicorp.forecastapi.config;

import com.ospicorp.forecastapi.forecast.error.ForecastException;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.error.InvalidParameterException;
import com.ospicorp.forecastapi.forecast.error.ModelException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_BASE = "https://docs.forecast-api.dev/problems/";

  @ExceptionHandler(InputException.class)
  public ResponseEntity<ProblemDetail> handleInput(InputException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "invalid-input", ex, request);
  }

  @ExceptionHandler(ModelException.class)
  public ResponseEntity<ProblemDetail> handleModel(ModelException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, "model-error", ex, request);
  }

  @ExceptionHandler(ForecastException.class)
  public ResponseEntity<ProblemDetail> handleAnalysis(ForecastException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("parameter", ex.parameter());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body);
  }

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "invalid-parameter", ex, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ProblemDetail> handleTooLarge(MaxUploadSizeExceededException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.PAYLOAD_TOO_LARGE, "upload-too-large", ex, request);
  }

  @ExceptionHandler(MultipartException.class)
  public ResponseEntity<ProblemDetail> handleMultipart(MultipartException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "invalid-upload", ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String slug, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE + slug));
    detail.setProperty("path", request.getRequestURI());
    if (ex instanceof ForecastException forecastException) {
      detail.setProperty("kind", forecastException.kind().name().toLowerCase(Locale.ROOT));
    }
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
        .body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    if (status.is5xxServerError()) {
      log.error("Request {} {} failed with status {}: {}",
          request.getMethod(), request.getRequestURI(), status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} returned status {}: {}",
          request.getMethod(), request.getRequestURI(), status.value(), errorMessage);
    }
  }
}
