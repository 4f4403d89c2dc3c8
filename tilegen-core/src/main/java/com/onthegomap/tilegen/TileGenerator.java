package com.onthegomap.tilegen;

import com.onthegomap.tilegen.config.Arguments;
import com.onthegomap.tilegen.config.TilegenConfig;
import com.onthegomap.tilegen.files.PyramidMetadata;
import com.onthegomap.tilegen.files.TileSchemeEncoding;
import com.onthegomap.tilegen.files.WriteableFilesArchive;
import com.onthegomap.tilegen.imaging.ImageDimensions;
import com.onthegomap.tilegen.imaging.ImageSource;
import com.onthegomap.tilegen.imaging.InvalidImageException;
import com.onthegomap.tilegen.imaging.Java2dImageProcessor;
import com.onthegomap.tilegen.pyramid.PyramidConfig;
import com.onthegomap.tilegen.pyramid.PyramidPlanner;
import com.onthegomap.tilegen.pyramid.TileTask;
import com.onthegomap.tilegen.stats.Stats;
import com.onthegomap.tilegen.util.BuildInfo;
import com.onthegomap.tilegen.util.Format;
import com.onthegomap.tilegen.worker.DispatchOutcome;
import com.onthegomap.tilegen.worker.DispatchSummary;
import com.onthegomap.tilegen.worker.TileDispatcher;
import com.onthegomap.tilegen.worker.TileRenderer;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a large source image into a {@code {z}/{x}/{y}} pyramid of fixed-size tiles.
 * <p>
 * A run goes through four stages: {@code plan} reads the image header and enumerates every tile, {@code directories}
 * creates the output folders, {@code render} renders tiles on a pool of worker threads, and {@code metadata} writes a
 * JSON description of the pyramid.
 */
public class TileGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileGenerator.class);
  private static final int MAX_LOGGED_FAILURES = 20;

  private final TilegenConfig config;
  private final Stats stats;

  public TileGenerator(TilegenConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /** Entry point: generates tiles and exits with the status from {@link #execute(String...)}. */
  public static void main(String... args) {
    System.exit(execute(args));
  }

  /**
   * Parses {@code args}, generates the pyramid, and returns the process exit code.
   *
   * @return {@code 0} on success, {@code 1} on invalid arguments, an unreadable image, an unwritable output directory,
   *         or if any tile failed or was skipped and {@code allow_tile_failures} is not set
   */
  public static int execute(String... args) {
    return execute(parseArguments(args), System.out, System.err, false);
  }

  /** Same as {@link #execute(String...)} but only logs the tile plan without writing anything. */
  public static int executePlan(String... args) {
    return execute(parseArguments(args), System.out, System.err, true);
  }

  static Arguments parseArguments(String... args) {
    return Arguments.fromArgsOrConfigFile(TilegenConfig.expandShortOptions(args)).withExactlyOnceLogging();
  }

  static int execute(Arguments arguments, PrintStream out, PrintStream err, boolean planOnly) {
    TilegenConfig config;
    try {
      if (arguments.getBoolean("help", "print usage and exit", false)) {
        out.print(TilegenConfig.usage());
        return 0;
      }
      if (arguments.getBoolean("version", "print version and exit", false)) {
        out.println("tilegen " + BuildInfo.get().version());
        return 0;
      }
      config = TilegenConfig.from(arguments);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      err.print(TilegenConfig.usage());
      return 1;
    }

    try (Stats stats = Stats.inMemory()) {
      var generator = new TileGenerator(config, stats);
      if (planOnly) {
        generator.plan();
        return 0;
      }
      DispatchSummary summary = generator.run();
      return exitCode(summary, config.allowTileFailures());
    } catch (InvalidImageException | IllegalArgumentException | UncheckedIOException e) {
      LOGGER.error("Error generating tiles: {}", e.getMessage(), e);
      return 1;
    }
  }

  static int exitCode(DispatchSummary summary, boolean allowTileFailures) {
    return summary.isSuccess() || allowTileFailures ? 0 : 1;
  }

  /**
   * Reads the source image header and returns the pyramid geometry, logging how many tiles each zoom level has.
   *
   * @throws InvalidImageException if the image cannot be read
   */
  public PyramidConfig plan() throws InvalidImageException {
    var timer = stats.startStage("plan");
    try {
      ImageDimensions dimensions = ImageSource.probe(config.input());
      PyramidConfig pyramid = PyramidPlanner.plan(config.tileSize(), config.maxMagnification(), dimensions.width(),
        dimensions.height());
      Format format = Format.defaultInstance();
      LOGGER.info("{} is {}, tile size {} at {}x magnification, zoom 0-{} with {} tiles", config.input(), dimensions,
        pyramid.tileSize(), pyramid.maxMagnification(), pyramid.maxZoom(),
        format.integer(PyramidPlanner.countTasks(pyramid)));
      for (int z = 0; z <= pyramid.maxZoom(); z++) {
        LOGGER.debug("z{}: {}x{} tiles, {} source px per tile", z, pyramid.cols(z), pyramid.rows(z),
          format.decimal(pyramid.coverage(z)));
      }
      return pyramid;
    } finally {
      timer.stop();
    }
  }

  /**
   * Generates every tile and the metadata file.
   *
   * @return the outcome of rendering every tile
   * @throws InvalidImageException if the image cannot be read or decoded
   * @throws UncheckedIOException  if the output directories cannot be created or the blank tile cannot be encoded
   */
  public DispatchSummary run() throws InvalidImageException {
    PyramidConfig pyramid = plan();
    List<TileTask> tasks = PyramidPlanner.buildTasks(pyramid);

    var encoding = new TileSchemeEncoding(config.tileScheme(), config.output(), config.tileFormat().extension());
    var timer = stats.startStage("directories");
    WriteableFilesArchive archive;
    try {
      archive = WriteableFilesArchive.newWriter(config.output(), encoding, config.metadataPath());
      int created = archive.createDirectories(tasks);
      LOGGER.info("Created {} directories under {}", created, config.output());
    } finally {
      timer.stop();
    }
    stats.monitorFile("tiles", config.output());

    DispatchSummary summary;
    timer = stats.startStage("render");
    try {
      BufferedImage image = ImageSource.decode(config.input());
      if (image.getWidth() != pyramid.imageWidth() || image.getHeight() != pyramid.imageHeight()) {
        throw new InvalidImageException("Decoded " + image.getWidth() + "x" + image.getHeight() +
          " but header says " + pyramid.imageWidth() + "x" + pyramid.imageHeight());
      }
      var processor = new Java2dImageProcessor(image, pyramid.tileSize(),
        config.tileFormat().newEncoder(config.encoderOptions()));
      TileRenderer renderer;
      try {
        renderer = new TileRenderer(pyramid, processor, archive, stats);
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to encode " + config.tileFormat().extension() + " tiles", e);
      }
      LOGGER.info("Rendering {} tiles as {} with {} threads", tasks.size(), config.tileFormat().extension(),
        config.threads());
      var dispatcher = new TileDispatcher(tasks, renderer, config.threads(), stats, config.logInterval(),
        config.timeout());
      summary = dispatcher.run();
    } finally {
      timer.stop();
    }

    timer = stats.startStage("metadata");
    try {
      archive.writeMetadata(PyramidMetadata.of(pyramid, config.tileFormat(), encoding.tileScheme(), tasks.size(),
        "tilegen " + BuildInfo.get().version()))
        .ifPresent(path -> LOGGER.info("Wrote {}", path));
    } finally {
      timer.stop();
    }

    stats.printSummary();
    logResult(summary);
    return summary;
  }

  private void logResult(DispatchSummary summary) {
    String elapsed = Format.clock(summary.elapsed());
    if (summary.isSuccess()) {
      LOGGER.info("Generated {} tiles in {}", summary.succeededCount(), elapsed);
      return;
    }
    List<DispatchOutcome.Failed> failures = summary.failures();
    for (var failure : failures.subList(0, Math.min(MAX_LOGGED_FAILURES, failures.size()))) {
      LOGGER.warn("Failed {}: {}", failure.task(), failure.reason());
    }
    if (failures.size() > MAX_LOGGED_FAILURES) {
      LOGGER.warn("... and {} more failures", failures.size() - MAX_LOGGED_FAILURES);
    }
    LOGGER.warn("Generated {} of {} tiles in {}: {} failed, {} skipped", summary.succeededCount(),
      summary.totalCount(), elapsed, summary.failedCount(), summary.skippedCount());
  }
}
