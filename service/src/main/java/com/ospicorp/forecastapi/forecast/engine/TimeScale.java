package com.ospicorp.forecastapi.forecast.engine;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

final class TimeScale {
  private static final double SECONDS_PER_DAY = 86_400d;

  private TimeScale() {
  }

  static double epochDays(LocalDateTime timestamp) {
    return timestamp.toEpochSecond(ZoneOffset.UTC) / SECONDS_PER_DAY
        + timestamp.getNano() / 1e9d / SECONDS_PER_DAY;
  }
}
