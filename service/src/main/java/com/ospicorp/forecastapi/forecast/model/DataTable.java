package com.ospicorp.forecastapi.forecast.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Header-row table with text cells. A {@code null} cell is a missing value.
 */
public final class DataTable {
  private final List<String> columns;
  private final List<List<String>> rows;

  public DataTable(List<String> columns, List<List<String>> rows) {
    Set<String> seen = new HashSet<>();
    for (String column : columns) {
      if (column == null || !seen.add(column)) {
        throw new IllegalArgumentException("Column names must be unique and non-null: " + columns);
      }
    }
    this.columns = List.copyOf(columns);
    List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      if (row.size() != columns.size()) {
        throw new IllegalArgumentException(
            "Row has " + row.size() + " cells, expected " + columns.size());
      }
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public static DataTable of(List<String> columns, String[]... rows) {
    List<List<String>> data = new ArrayList<>(rows.length);
    for (String[] row : rows) {
      data.add(Arrays.asList(row));
    }
    return new DataTable(columns, data);
  }

  public List<String> columns() {
    return columns;
  }

  public List<List<String>> rows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public int indexOf(String column) {
    return columns.indexOf(column);
  }

  public List<String> column(String name) {
    int idx = columns.indexOf(name);
    if (idx < 0) {
      throw new IllegalArgumentException("Unknown column: " + name);
    }
    List<String> values = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      values.add(row.get(idx));
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DataTable other)) return false;
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + rows.hashCode();
  }

  @Override
  public String toString() {
    return "DataTable" + columns + "[" + rows.size() + " rows]";
  }
}
