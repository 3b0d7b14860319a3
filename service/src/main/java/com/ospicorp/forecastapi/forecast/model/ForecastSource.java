package com.ospicorp.forecastapi.forecast.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the pipeline takes its table from: a previously stored CSV or a table already in memory.
 */
public sealed interface ForecastSource permits ForecastSource.StoredTable, ForecastSource.LoadedTable {

  static ForecastSource stored(Path path) {
    return new StoredTable(path);
  }

  static ForecastSource loaded(DataTable table) {
    return new LoadedTable(table);
  }

  record StoredTable(Path path) implements ForecastSource {
    public StoredTable {
      Objects.requireNonNull(path, "path");
    }
  }

  record LoadedTable(DataTable table) implements ForecastSource {
    public LoadedTable {
      Objects.requireNonNull(table, "table");
    }
  }
}
