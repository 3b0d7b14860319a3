package com.ospicorp.forecastapi.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void acceptsCommonDateAndDateTimeForms() {
    var out = TimestampParser.parseAll(List.of(
        "2024-03-01",
        "2024-03-01 13:45:10",
        "2024-03-01T13:45",
        "2024/03/02",
        "03/15/2024",
        "2024-3-5 7:05:00.250"));

    assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), out.get(0));
    assertEquals(LocalDateTime.of(2024, 3, 1, 13, 45, 10), out.get(1));
    assertEquals(LocalDateTime.of(2024, 3, 1, 13, 45), out.get(2));
    assertEquals(LocalDateTime.of(2024, 3, 2, 0, 0), out.get(3));
    assertEquals(LocalDateTime.of(2024, 3, 15, 0, 0), out.get(4));
    assertEquals(LocalDateTime.of(2024, 3, 5, 7, 5, 0, 250_000_000), out.get(5));
  }

  @Test
  void uniformOffsetIsStrippedKeepingWallClockTime() {
    var out = TimestampParser.parseAll(List.of(
        "2024-03-01T10:00:00+02:00",
        "2024-03-02T10:00:00+02:00"));

    assertEquals(LocalDateTime.of(2024, 3, 1, 10, 0), out.get(0));
    assertEquals(LocalDateTime.of(2024, 3, 2, 10, 0), out.get(1));
  }

  @Test
  void mixedOffsetsAreRejected() {
    var ex = assertThrows(InputException.class, () -> TimestampParser.parseAll(List.of(
        "2024-03-01T10:00:00Z", "2024-03-02T10:00:00+01:00")));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, ex.kind());

    var naiveThenZoned = assertThrows(InputException.class, () -> TimestampParser.parseAll(List.of(
        "2024-03-01", "2024-03-02T10:00:00Z")));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, naiveThenZoned.kind());
  }

  @Test
  void impossibleCalendarDatesAreRejectedNotClamped() {
    assertEquals(List.of(LocalDateTime.of(2024, 2, 29, 0, 0)),
        TimestampParser.parseAll(List.of("2024-02-29")));

    var feb30 = assertThrows(InputException.class,
        () -> TimestampParser.parseAll(List.of("2024-02-29", "2024-02-30")));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, feb30.kind());

    var notLeap = assertThrows(InputException.class,
        () -> TimestampParser.parseAll(List.of("2023-02-29")));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, notLeap.kind());

    assertThrows(InputException.class, () -> TimestampParser.parseAll(List.of("04/31/2024")));
    assertThrows(InputException.class,
        () -> TimestampParser.parseAll(List.of("2024-03-01 24:30")));
  }

  @Test
  void unparseableOrMissingValueFails() {
    var garbage = assertThrows(InputException.class,
        () -> TimestampParser.parseAll(List.of("2024-01-01", "next tuesday")));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, garbage.kind());
    assertTrue(garbage.getMessage().contains("row 2"));

    var missing = assertThrows(InputException.class,
        () -> TimestampParser.parseAll(Arrays.asList("2024-01-01", null)));
    assertEquals(ErrorKind.DATE_PARSE_FAILURE, missing.kind());
  }
}
