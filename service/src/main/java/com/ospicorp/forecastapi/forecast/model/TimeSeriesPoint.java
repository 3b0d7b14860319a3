package com.ospicorp.forecastapi.forecast.model;

import java.time.LocalDateTime;

// Historical observation after timestamp parsing
public record TimeSeriesPoint(LocalDateTime timestamp, double value) {}
