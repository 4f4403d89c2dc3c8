package com.onthegomap.tilegen.config;

import com.google.common.collect.Sets;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of the {@code key=value} options for a run, gathered from the command line, JVM properties,
 * environmental variables, or a properties file.
 * <p>
 * Keys are case-insensitive and {@code -}, {@code _} and {@code .} are interchangeable, so {@code --tile-size},
 * {@code tile_size} and {@code TILEGEN_TILE_SIZE} all name the same option.
 */
public final class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Looks up a value by its canonical key, returning {@code null} when absent. */
  private final UnaryOperator<String> lookup;
  /** Keys already logged, or {@code null} to log every read. */
  private final Set<String> logged;

  private Arguments(UnaryOperator<String> lookup, Set<String> logged) {
    this.lookup = lookup;
    this.logged = logged;
  }

  static String canonical(String key) {
    return key.strip()
      .replaceFirst("^-+", "")
      .toLowerCase(Locale.ROOT)
      .replace('-', '_')
      .replace('.', '_');
  }

  public static Arguments of(Map<String, String> values) {
    Map<String, String> byKey = new LinkedHashMap<>();
    values.forEach((key, value) -> byKey.put(canonical(key), value));
    return new Arguments(byKey::get, null);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      values.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(values);
  }

  /**
   * Parses command-line arguments in any of the forms {@code key=value}, {@code --key=value}, {@code --key value}, or
   * a bare {@code --flag} which means {@code flag=true}. A negative number after {@code --key} is its value.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      int eq = arg.indexOf('=');
      if (eq >= 0) {
        values.put(arg.substring(0, eq), arg.substring(eq + 1));
      } else if (arg.startsWith("-") && i + 1 < args.length && !isOption(args[i + 1].strip())) {
        values.put(arg, args[++i].strip());
      } else {
        values.put(arg, "true");
      }
    }
    return of(values);
  }

  /** Returns true for {@code --key} or {@code -k}, false for a value such as {@code -1} or {@code -0.5}. */
  private static boolean isOption(String token) {
    return token.startsWith("--") || (token.startsWith("-") && !NumberUtils.isCreatable(token));
  }

  /** Reads options from JVM properties like {@code -Dtilegen.tile_size=512}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System.getProperties());
  }

  static Arguments fromJvmProperties(Properties properties) {
    return new Arguments(key -> properties.getProperty("tilegen." + key), null);
  }

  /** Reads options from environmental variables like {@code TILEGEN_TILE_SIZE=512}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static Arguments fromEnvironment(Map<String, String> env) {
    return new Arguments(key -> env.get("TILEGEN_" + key.toUpperCase(Locale.ROOT)), null);
  }

  /**
   * Reads options from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      values.put(name, properties.getProperty(name));
    }
    return of(values);
  }

  /**
   * Combines every source of options. Earlier sources win:
   * <ol>
   * <li>command-line arguments</li>
   * <li>JVM properties</li>
   * <li>environmental variables</li>
   * <li>the properties file named by the {@code config} option from any of the above</li>
   * </ol>
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments base = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    String config = base.value("config");
    return config == null ? base : base.orElse(fromConfigFile(Path.of(config)));
  }

  /** Returns options that read from {@code this} first, then from {@code other}. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    }, logged);
  }

  /** Returns a copy that logs the value of each option the first time it is read, instead of on every read. */
  public Arguments withExactlyOnceLogging() {
    return new Arguments(lookup, Sets.newConcurrentHashSet());
  }

  private String value(String key) {
    String value = lookup.apply(canonical(key));
    return value == null ? null : value.strip();
  }

  private <T> T parse(String key, String description, T defaultValue, Function<String, T> parser, String expected) {
    String raw = value(key);
    T result;
    if (raw == null) {
      result = defaultValue;
    } else {
      try {
        result = parser.apply(raw);
      } catch (RuntimeException e) {
        throw new IllegalArgumentException(key + " must be " + expected + ", was '" + raw + "'", e);
      }
    }
    if (LOGGER.isDebugEnabled() && (logged == null || logged.add(canonical(key)))) {
      LOGGER.debug("option {}={} ({})", key, result, description);
    }
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    return parse(key, description, defaultValue, Function.identity(), "a string");
  }

  public Path file(String key, String description, Path defaultValue) {
    return parse(key, description, defaultValue, Path::of, "a path");
  }

  public int getInteger(String key, String description, int defaultValue) {
    return parse(key, description, defaultValue, Integer::parseInt, "an integer");
  }

  public double getDouble(String key, String description, double defaultValue) {
    return parse(key, description, defaultValue, Double::parseDouble, "a number");
  }

  /** Accepts {@code true} or {@code false} in any case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return parse(key, description, defaultValue, Arguments::parseBoolean, "true or false");
  }

  /**
   * Parses a duration like {@code 10s}, {@code 90m} or {@code 1h30m}.
   *
   * @param defaultValue returned when the option is not set, may be {@code null}
   */
  public Duration getDuration(String key, String description, Duration defaultValue) {
    return parse(key, description, defaultValue, value -> Duration.parse("PT" + value), "a duration like 30s");
  }

  /**
   * Returns the {@code threads} option, or the number of available processors when it is not set.
   *
   * @throws IllegalArgumentException if {@code threads} is not a positive integer
   */
  public int threads() {
    int threads = getInteger("threads", "number of render threads", Runtime.getRuntime().availableProcessors());
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    return threads;
  }

  private static boolean parseBoolean(String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    } else if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(value);
  }
}
