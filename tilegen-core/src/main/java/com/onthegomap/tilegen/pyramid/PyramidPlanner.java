package com.onthegomap.tilegen.pyramid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes how many zoom levels a source image needs and enumerates every tile in the pyramid.
 * <p>
 * Zoom {@code 0} fits the whole image in one tile and each level below doubles the resolution until one source pixel
 * spans {@code maxMagnification} tile pixels.
 */
public class PyramidPlanner {

  /** Deepest zoom level that keeps tile coordinates within an {@code int}. */
  public static final int MAX_ZOOM = 30;

  private PyramidPlanner() {}

  /**
   * Returns the smallest zoom {@code z >= 0} where {@code tileSize * 2^z >= max(width, height) * maxMagnification},
   * which is {@code ceil(log2(max(width, height) * maxMagnification / tileSize))} clamped at 0.
   *
   * @throws InvalidDimensionsException if {@code width} or {@code height} is not positive
   * @throws IllegalArgumentException   if {@code tileSize} or {@code maxMagnification} is not positive
   */
  public static int calculateMaxZoom(int maxMagnification, int tileSize, int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new InvalidDimensionsException(width, height);
    }
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tileSize must be > 0, was " + tileSize);
    }
    if (maxMagnification <= 0) {
      throw new IllegalArgumentException("maxMagnification must be > 0, was " + maxMagnification);
    }
    long target = (long) Math.max(width, height) * maxMagnification;
    int z = 0;
    while (z <= MAX_ZOOM && ((long) tileSize << z) < target) {
      z++;
    }
    if (z > MAX_ZOOM) {
      throw new IllegalArgumentException("Pyramid would need " + z + " zoom levels, max is " + MAX_ZOOM);
    }
    return z;
  }

  /** Returns the number of source pixels one tile spans at zoom {@code z}. */
  public static double coverage(int tileSize, int maxMagnification, int maxZoom, int z) {
    return Math.scalb((double) tileSize / maxMagnification, maxZoom - z);
  }

  /** Returns the pyramid geometry for a {@code width x height} source image. */
  public static PyramidConfig plan(int tileSize, int maxMagnification, int width, int height) {
    int maxZoom = calculateMaxZoom(maxMagnification, tileSize, width, height);
    return new PyramidConfig(tileSize, maxMagnification, width, height, maxZoom);
  }

  /**
   * Returns every tile from zoom {@code 0} to {@code maxZoom}, ordered by zoom then column then row.
   */
  public static List<TileTask> buildTasks(int width, int height, int maxZoom, int tileSize, int maxMagnification) {
    return buildTasks(new PyramidConfig(tileSize, maxMagnification, width, height, maxZoom));
  }

  /** Same as {@link #buildTasks(int, int, int, int, int)} using the geometry in {@code config}. */
  public static List<TileTask> buildTasks(PyramidConfig config) {
    long count = countTasks(config);
    if (count > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException("Too many tiles: " + count);
    }
    List<TileTask> tasks = new ArrayList<>((int) count);
    for (int z = 0; z <= config.maxZoom(); z++) {
      int cols = config.cols(z);
      int rows = config.rows(z);
      for (int x = 0; x < cols; x++) {
        for (int y = 0; y < rows; y++) {
          tasks.add(new TileTask(z, x, y));
        }
      }
    }
    return Collections.unmodifiableList(tasks);
  }

  /** Returns the number of tiles {@link #buildTasks(PyramidConfig)} would emit without enumerating them. */
  public static long countTasks(PyramidConfig config) {
    long total = 0;
    for (int z = 0; z <= config.maxZoom(); z++) {
      total += countTasks(config, z);
    }
    return total;
  }

  /** Returns the number of tiles at zoom {@code z}. */
  public static long countTasks(PyramidConfig config, int z) {
    return (long) config.cols(z) * config.rows(z);
  }
}
