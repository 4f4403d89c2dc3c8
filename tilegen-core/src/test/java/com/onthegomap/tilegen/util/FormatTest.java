package com.onthegomap.tilegen.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.Locale;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  @ParameterizedTest
  @CsvSource({
    "1.5,1,en",
    "999,999,en",
    "1000,1k,en",
    "9999,9.9k,en",
    "10001,10k,en",
    "9999999,9.9M,en",
    "-9999999,-,en",
    "5.5e12,5.5T,en",
    "5.5e12,'5,5T',fr",
  })
  void testFormatNumeric(Double number, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).numeric(number, false));
  }

  @ParameterizedTest
  @CsvSource({
    "999,999,en",
    "1000,1k,en",
    "5.5e9,5.5G,en",
  })
  void testFormatStorage(Double number, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).storage(number, false));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0%,en",
    "1,100%,en",
    "0.11111,11%,en",
  })
  void testFormatPercent(Double number, String formatted, Locale locale) {
    assertEquals(formatted, Format.forLocale(locale).percent(number));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0s,en",
    "0.1,0.1s,en",
    "1,1s,en",
    "60,1m,en",
    "3601,1h1s,en",
    "125,2m5s,en",
    "7260,2h1m,en",
  })
  void testFormatDuration(double seconds, String expected, Locale locale) {
    assertEquals(expected,
      Format.forLocale(locale).duration(Duration.ofNanos((long) (seconds * Duration.ofSeconds(1).toNanos()))));
  }

  @ParameterizedTest
  @CsvSource({
    "0,00:00:00",
    "59,00:00:59",
    "61,00:01:01",
    "3600,01:00:00",
    "86399,23:59:59",
    "360000,100:00:00",
  })
  void testClock(long seconds, String expected) {
    assertEquals(expected, Format.clock(Duration.ofSeconds(seconds)));
    assertEquals(expected, Format.clock((double) seconds));
  }

  @ParameterizedTest
  @CsvSource({
    "1.9,00:00:01",
    "-5,00:00:00",
    "NaN,00:00:00",
    "Infinity,00:00:00",
  })
  void testClockFractionalAndInvalid(double seconds, String expected) {
    assertEquals(expected, Format.clock(seconds));
  }

  @ParameterizedTest
  @CsvSource({
    "5,'   5'",
    "0.5,'  <1'",
    "1500,1.5k",
    "123456,123k",
  })
  void testPaddedNumeric(double number, String expected) {
    assertEquals(expected, Format.forLocale(Locale.ENGLISH).numeric(number, true));
  }
}
