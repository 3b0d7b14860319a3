package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the {@code ds} column into timezone-naive timestamps. Offsets are accepted only when
 * every value carries the same one; they are then dropped and the wall-clock time kept.
 * Calendar-invalid dates such as {@code 2023-02-29} are rejected, not clamped.
 */
public final class TimestampParser {

  private static final List<DateTimeFormatter> FORMATTERS = List.of(
      formatter("uuuu-M-d"),
      formatter("uuuu/M/d"),
      formatter("M/d/uuuu"));

  private TimestampParser() {
  }

  public static List<LocalDateTime> parseAll(List<String> values) {
    List<LocalDateTime> out = new ArrayList<>(values.size());
    ZoneOffset sharedOffset = null;
    boolean sawNaive = false;
    for (int i = 0; i < values.size(); i++) {
      TemporalAccessor parsed = parseOne(values.get(i), i + 1);
      if (parsed instanceof OffsetDateTime odt) {
        if (sharedOffset != null && !sharedOffset.equals(odt.getOffset())) {
          throw mixedZones();
        }
        sharedOffset = odt.getOffset();
        out.add(odt.toLocalDateTime());
      } else if (parsed instanceof LocalDateTime ldt) {
        sawNaive = true;
        out.add(ldt);
      } else {
        sawNaive = true;
        out.add(((LocalDate) parsed).atStartOfDay());
      }
      if (sawNaive && sharedOffset != null) {
        throw mixedZones();
      }
    }
    return out;
  }

  static TemporalAccessor parseOne(String raw, int row) {
    String message = "Could not parse 'ds' column as dates (row " + row + ": '" + raw + "').";
    if (raw == null || raw.isBlank()) {
      throw new InputException(ErrorKind.DATE_PARSE_FAILURE, message);
    }
    String text = raw.trim();
    DateTimeParseException failure = null;
    for (DateTimeFormatter formatter : FORMATTERS) {
      try {
        return formatter.parseBest(text, OffsetDateTime::from, LocalDateTime::from,
            LocalDate::from);
      } catch (DateTimeParseException ex) {
        failure = ex;
      }
    }
    throw new InputException(ErrorKind.DATE_PARSE_FAILURE, message, failure);
  }

  private static InputException mixedZones() {
    return new InputException(ErrorKind.DATE_PARSE_FAILURE,
        "Could not parse 'ds' column as dates: mixed timezones detected.");
  }

  private static DateTimeFormatter formatter(String datePattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(datePattern)
        .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .appendPattern("H:mm")
        .optionalStart().appendPattern(":ss").optionalEnd()
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
        .optionalEnd()
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
