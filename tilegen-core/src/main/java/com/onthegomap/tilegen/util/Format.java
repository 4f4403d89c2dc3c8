package com.onthegomap.tilegen.util;

import com.google.common.base.Strings;
import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Short human-readable renderings of counts, byte sizes, percentages and durations for progress logs.
 */
public final class Format {

  private static final ConcurrentMap<Locale, Format> INSTANCES = new ConcurrentHashMap<>();
  private static final String[] COUNT_UNITS = {"", "k", "M", "B", "T", "Q"};
  private static final String[] BYTE_UNITS = {"", "k", "M", "G", "T", "P"};
  private static final int PADDED_WIDTH = 4;

  // NumberFormat is not thread safe
  private final ThreadLocal<NumberFormat> percentFormat;
  private final ThreadLocal<NumberFormat> decimalFormat;
  private final ThreadLocal<NumberFormat> integerFormat;

  private Format(Locale locale) {
    percentFormat = withDigits(locale, NumberFormat::getPercentInstance, 0);
    decimalFormat = withDigits(locale, NumberFormat::getNumberInstance, 1);
    integerFormat = withDigits(locale, NumberFormat::getNumberInstance, 0);
  }

  private static ThreadLocal<NumberFormat> withDigits(Locale locale, Function<Locale, NumberFormat> factory,
    int maxFractionDigits) {
    return ThreadLocal.withInitial(() -> {
      NumberFormat format = factory.apply(locale);
      format.setMaximumFractionDigits(maxFractionDigits);
      return format;
    });
  }

  public static Format forLocale(Locale locale) {
    return INSTANCES.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(Locale.getDefault(Locale.Category.FORMAT));
  }

  /** Returns a count like "999", "1.2k" or "25M", left-padded to 4 characters when {@code pad} is set. */
  public String numeric(Number num, boolean pad) {
    return scaled(num, COUNT_UNITS, pad);
  }

  /** Returns a byte size like "512", "1.5M" or "12G", left-padded to 4 characters when {@code pad} is set. */
  public String storage(Number num, boolean pad) {
    return scaled(num, BYTE_UNITS, pad);
  }

  private String scaled(Number num, String[] units, boolean pad) {
    double value = num.doubleValue();
    String result;
    if (value < 0) {
      result = "-";
    } else if (value > 0 && value < 1) {
      result = "<1";
    } else {
      long whole = num.longValue();
      long divisor = 1;
      int unit = 0;
      while (unit + 1 < units.length && whole >= divisor * 1000) {
        divisor *= 1000;
        unit++;
      }
      if (unit == 0) {
        result = Long.toString(whole);
      } else {
        // one decimal digit below 10 of a unit, none above
        long tenths = whole / (divisor / 10);
        String digits = tenths < 100 && tenths % 10 != 0 ? decimal(tenths / 10d) : Long.toString(tenths / 10);
        result = digits + units[unit];
      }
    }
    return pad ? Strings.padStart(result, PADDED_WIDTH, ' ') : result;
  }

  /** Returns a 0-1 ratio as a whole percentage like "42%". */
  public String percent(double ratio) {
    return percentFormat.get().format(ratio);
  }

  public String decimal(double value) {
    return decimalFormat.get().format(value);
  }

  public String integer(Number value) {
    return integerFormat.get().format(value);
  }

  /** Returns a compact duration like "0.3s", "45s", "2m5s" or "1h1s". */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() / 1e9;
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    long total = Math.round(seconds);
    StringBuilder result = new StringBuilder();
    if (total >= 3600) {
      result.append(total / 3600).append('h');
    }
    if (total % 3600 >= 60) {
      result.append((total % 3600) / 60).append('m');
    }
    if (total % 60 != 0 || result.length() == 0) {
      result.append(total % 60).append('s');
    }
    return result.toString();
  }

  /** Returns a duration as a clock reading like "01:02:03", truncating fractional seconds. */
  public static String clock(Duration duration) {
    long seconds = Math.max(0, duration.getSeconds());
    return "%02d:%02d:%02d".formatted(seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }

  /** Same as {@link #clock(Duration)} for a fractional number of seconds, or zero when not finite. */
  public static String clock(double seconds) {
    if (!Double.isFinite(seconds) || seconds < 0) {
      return clock(Duration.ZERO);
    }
    return clock(Duration.ofSeconds((long) Math.floor(seconds)));
  }
}
