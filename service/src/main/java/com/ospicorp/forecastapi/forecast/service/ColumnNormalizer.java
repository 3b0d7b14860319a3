package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ColumnNormalizer {
  public static final String DATE_COLUMN = "ds";
  public static final String VALUE_COLUMN = "y";

  private static final Set<String> DATE_NAMES = Set.of("date", "ds", "timestamp", "time");
  private static final List<String> VALUE_NAMES =
      List.of("value", "sales", "revenue", "quantity", "amount", "close", "price");

  // tokens CSV tools conventionally write for a missing cell
  private static final Set<String> MISSING_TOKENS = Set.of("#N/A", "#N/A N/A", "#NA",
      "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA", "NULL",
      "NaN", "None", "n/a", "nan", "null");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
  private static final Pattern INFINITY =
      Pattern.compile("([+-]?)(?:inf|infinity)", Pattern.CASE_INSENSITIVE);

  private ColumnNormalizer() {
  }

  public static DataTable normalize(DataTable table) {
    String dateColumn = detectDateColumn(table.columns());
    if (dateColumn == null) {
      throw new InputException(ErrorKind.NO_DATE_COLUMN,
          "Could not detect a date column (looking for 'ds', 'date', 'timestamp').");
    }
    String targetColumn = detectTargetColumn(table, dateColumn);
    if (targetColumn == null) {
      throw new InputException(ErrorKind.NO_TARGET_COLUMN,
          "Could not detect a numeric target column. Please ensure one exists.");
    }

    int dateIdx = table.indexOf(dateColumn);
    int targetIdx = table.indexOf(targetColumn);
    List<List<String>> rows = new ArrayList<>(table.rowCount());
    for (List<String> row : table.rows()) {
      String value = row.get(targetIdx);
      if (parseNumber(value) == null) {
        continue;
      }
      List<String> out = new ArrayList<>(2);
      out.add(row.get(dateIdx));
      out.add(value);
      rows.add(out);
    }
    return new DataTable(List.of(DATE_COLUMN, VALUE_COLUMN), rows);
  }

  static String detectDateColumn(List<String> columns) {
    if (columns.contains(DATE_COLUMN)) {
      return DATE_COLUMN;
    }
    for (String column : columns) {
      if (DATE_NAMES.contains(column.toLowerCase(Locale.ROOT))) {
        return column;
      }
    }
    return null;
  }

  static String detectTargetColumn(DataTable table, String dateColumn) {
    List<String> candidates = new ArrayList<>(table.columns());
    candidates.remove(dateColumn);

    if (candidates.contains(VALUE_COLUMN)) {
      return VALUE_COLUMN;
    }
    for (String column : candidates) {
      if (VALUE_COLUMN.equals(column.toLowerCase(Locale.ROOT))) {
        return column;
      }
    }
    // column order decides between several common names, not the order of VALUE_NAMES
    for (String column : candidates) {
      if (VALUE_NAMES.contains(column.toLowerCase(Locale.ROOT))) {
        return column;
      }
    }
    for (String column : candidates) {
      if (isNumericColumn(table.column(column))) {
        return column;
      }
    }
    return null;
  }

  private static boolean isNumericColumn(List<String> values) {
    boolean sawValue = false;
    for (String value : values) {
      if (isMissing(value)) {
        continue;
      }
      if (parseNumber(value) == null) {
        return false;
      }
      sawValue = true;
    }
    return sawValue;
  }

  /**
   * Lenient numeric coercion: blank, NA-token and unparseable cells all count as missing.
   * Only plain decimal and scientific notation is numeric; Java literal suffixes and hex
   * floats are not.
   */
  public static Double parseNumber(String value) {
    if (isMissing(value)) {
      return null;
    }
    String text = value.trim();
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    Matcher infinity = INFINITY.matcher(text);
    if (infinity.matches()) {
      return "-".equals(infinity.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return null;
  }

  static boolean isMissing(String value) {
    return value == null || value.isBlank() || MISSING_TOKENS.contains(value.trim());
  }
}
