package com.onthegomap.tilegen.pyramid;

/**
 * Immutable geometry of a tile pyramid computed once per run and shared by every worker.
 *
 * @param tileSize         edge length of each output tile in pixels
 * @param maxMagnification how many tile pixels each source pixel spans along one axis at {@code maxZoom}
 * @param imageWidth       source image width in pixels
 * @param imageHeight      source image height in pixels
 * @param maxZoom          deepest zoom level, {@code 0} is the whole image in a single tile
 */
public record PyramidConfig(int tileSize, int maxMagnification, int imageWidth, int imageHeight, int maxZoom) {

  public PyramidConfig {
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tileSize must be > 0, was " + tileSize);
    }
    if (maxMagnification <= 0) {
      throw new IllegalArgumentException("maxMagnification must be > 0, was " + maxMagnification);
    }
    if (imageWidth <= 0 || imageHeight <= 0) {
      throw new InvalidDimensionsException(imageWidth, imageHeight);
    }
    if (maxZoom < 0 || maxZoom > PyramidPlanner.MAX_ZOOM) {
      throw new IllegalArgumentException("maxZoom must be in [0, " + PyramidPlanner.MAX_ZOOM + "], was " + maxZoom);
    }
  }

  /** Returns the number of source pixels one tile spans along each axis at zoom {@code z}. */
  public double coverage(int z) {
    return PyramidPlanner.coverage(tileSize, maxMagnification, maxZoom, z);
  }

  /** Returns the number of tile columns at zoom {@code z}. */
  public int cols(int z) {
    return (int) Math.ceil(imageWidth / coverage(z));
  }

  /** Returns the number of tile rows at zoom {@code z}. */
  public int rows(int z) {
    return (int) Math.ceil(imageHeight / coverage(z));
  }

  /**
   * Returns the source region {@code task} covers clamped to the image bounds, and where it goes on the tile canvas.
   * <p>
   * Pixel edges are rounded half-up. A non-empty region always resamples to at least one pixel.
   */
  public SourceWindow window(TileTask task) {
    double coverage = coverage(task.z());
    int sx = (int) Math.max(0, Math.round(task.x() * coverage));
    int sy = (int) Math.max(0, Math.round(task.y() * coverage));
    int ex = (int) Math.min(imageWidth, Math.round((task.x() + 1) * coverage));
    int ey = (int) Math.min(imageHeight, Math.round((task.y() + 1) * coverage));
    int sw = ex - sx;
    int sh = ey - sy;
    if (sw <= 0 || sh <= 0) {
      return new SourceWindow(sx, sy, sw, sh, 0, 0, 0, 0);
    }
    int targetWidth = (int) Math.max(1, Math.round(sw / coverage * tileSize));
    int targetHeight = (int) Math.max(1, Math.round(sh / coverage * tileSize));
    int offsetX = (int) Math.round((sx - task.x() * coverage) / coverage * tileSize);
    int offsetY = (int) Math.round((sy - task.y() * coverage) / coverage * tileSize);
    return new SourceWindow(sx, sy, sw, sh, offsetX, offsetY, targetWidth, targetHeight);
  }
}
