package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDateTime;

/**
 * Historical point whose actual value fell outside the predicted interval.
 * {@code severity} is the absolute deviation in the series' own units.
 */
@JsonPropertyOrder({"ds", "y", "yhat", "yhat_lower", "yhat_upper", "severity", "severity_level"})
public record Anomaly(
    @JsonProperty("ds") LocalDateTime timestamp,
    @JsonProperty("y") double actual,
    @JsonProperty("yhat") double estimate,
    @JsonProperty("yhat_lower") double lower,
    @JsonProperty("yhat_upper") double upper,
    @JsonProperty("severity") double severity,
    @JsonProperty("severity_level") SeverityLevel severityLevel
) {}
