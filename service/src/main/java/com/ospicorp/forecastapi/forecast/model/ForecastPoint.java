package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDateTime;

@JsonPropertyOrder({"ds", "yhat", "yhat_lower", "yhat_upper"})
public record ForecastPoint(
    @JsonProperty("ds") LocalDateTime timestamp,
    @JsonProperty("yhat") double estimate,
    @JsonProperty("yhat_lower") double lower,
    @JsonProperty("yhat_upper") double upper
) {}
