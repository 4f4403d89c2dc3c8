package com.onthegomap.tilegen.config;

import com.onthegomap.tilegen.files.TileSchemeEncoding;
import com.onthegomap.tilegen.imaging.EncoderOptions;
import com.onthegomap.tilegen.imaging.TileFormat;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings for one tile generation run, read once from {@link Arguments} and passed to every component.
 */
public record TilegenConfig(
  Arguments arguments,
  int tileSize,
  TileFormat tileFormat,
  int maxMagnification,
  Path input,
  Path output,
  int threads,
  Duration logInterval,
  Duration timeout,
  boolean allowTileFailures,
  String tileScheme,
  String metadataPath,
  EncoderOptions encoderOptions
) {

  public static final int DEFAULT_TILE_SIZE = 256;
  public static final int DEFAULT_MAX_MAGNIFICATION = 1;
  public static final Path DEFAULT_INPUT = Path.of("./input.png");
  public static final Path DEFAULT_OUTPUT = Path.of("./out/");

  /** Single-dash aliases accepted on the command line. */
  public static final Map<String, String> SHORT_OPTIONS = Map.of(
    "t", "tile_size",
    "f", "tile_format",
    "m", "max_mag",
    "i", "input",
    "o", "output",
    "v", "version",
    "h", "help"
  );

  public TilegenConfig {
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tile_size must be > 0, was " + tileSize);
    }
    if (maxMagnification <= 0) {
      throw new IllegalArgumentException("max_mag must be > 0, was " + maxMagnification);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (logInterval.isNegative() || logInterval.isZero()) {
      throw new IllegalArgumentException("log_interval must be positive, was " + logInterval);
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive, was " + timeout);
    }
  }

  /**
   * Reads every setting from {@code arguments}, applying defaults for the ones that are missing.
   *
   * @throws IllegalArgumentException if a value is missing, not a number, or out of range
   */
  public static TilegenConfig from(Arguments arguments) {
    return new TilegenConfig(
      arguments,
      arguments.getInteger("tile_size", "edge length of each tile in pixels", DEFAULT_TILE_SIZE),
      TileFormat.parseOrDefault(arguments.getString("tile_format", "tile format: png, jpg or webp", "png")),
      arguments.getInteger("max_mag", "tile pixels per source pixel at the deepest zoom", DEFAULT_MAX_MAGNIFICATION),
      arguments.file("input", "source image", DEFAULT_INPUT),
      arguments.file("output", "output directory", DEFAULT_OUTPUT),
      arguments.threads(),
      arguments.getDuration("log_interval", "how often to log progress", Duration.ofSeconds(10)),
      arguments.getDuration("timeout", "stop dispatching tiles after this long", null),
      arguments.getBoolean("allow_tile_failures", "exit with 0 even if some tiles failed", false),
      arguments.getString("tile_scheme", "tile path template like {z}/{x}/{y}.{ext}",
        TileSchemeEncoding.DEFAULT_SCHEME),
      arguments.getString("metadata_path", "pyramid metadata file relative to output, or \"none\"", "metadata.json"),
      new EncoderOptions(
        arguments.getInteger("png_compression", "png deflate level, -1 for default or 0-9", -1),
        (float) arguments.getDouble("jpeg_quality", "jpeg quality 0-1", 0.9),
        (float) arguments.getDouble("webp_quality", "lossy webp quality 0-1", 0.9)
      )
    );
  }

  /**
   * Rewrites single-dash aliases like {@code -t 512} or {@code -t=512} to {@code --tile_size 512}.
   */
  public static String[] expandShortOptions(String... args) {
    List<String> result = new ArrayList<>(args.length);
    for (String arg : args) {
      String expanded = arg;
      if (arg.length() >= 2 && arg.charAt(0) == '-' && arg.charAt(1) != '-') {
        String[] kv = arg.substring(1).split("=", 2);
        String longName = SHORT_OPTIONS.get(kv[0]);
        if (longName != null) {
          expanded = "--" + longName + (kv.length == 2 ? "=" + kv[1] : "");
        }
      }
      result.add(expanded);
    }
    return result.toArray(String[]::new);
  }

  /** Returns the usage text printed for {@code --help} and after invalid arguments. */
  public static String usage() {
    return """
      Usage: tilegen [options]

        -i, --input=PATH            source image (default ./input.png)
        -o, --output=DIR            output directory (default ./out/)
        -t, --tile_size=N           tile edge in pixels (default 256)
        -m, --max_mag=N             tile pixels per source pixel at the deepest zoom (default 1)
        -f, --tile_format=FORMAT    png, jpg or webp (default png)
            --threads=N             worker threads (default: number of CPUs)
            --log_interval=DURATION progress log interval (default 10s)
            --timeout=DURATION      stop dispatching tiles after this long (default: none)
            --allow_tile_failures   exit with 0 even if some tiles failed
            --tile_scheme=TEMPLATE  tile path template (default {z}/{x}/{y}.{ext})
            --metadata_path=PATH    metadata file relative to output, or "none" (default metadata.json)
            --png_compression=N     png deflate level -1..9 (default -1)
            --jpeg_quality=Q        jpeg quality 0..1 (default 0.9)
            --webp_quality=Q        webp quality 0..1 (default 0.9)
            --config=FILE           read options from a properties file
        -v, --version               print the version and exit
        -h, --help                  print this message and exit

      Options may also be set as -Dtilegen.key=value or TILEGEN_KEY=value.
      """;
  }
}
