package com.onthegomap.tilegen.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Image operations a tile worker needs to turn a region of the source image into an encoded tile.
 * <p>
 * Implementations must be safe to call from every worker thread at once.
 */
public interface ImageProcessor {

  /** Returns the {@code sw x sh} region of the source image whose top-left corner is {@code (sx, sy)}. */
  BufferedImage extractRegion(int sx, int sy, int sw, int sh);

  /** Returns {@code image} scaled to {@code width x height} with nearest-neighbour sampling. */
  BufferedImage resample(BufferedImage image, int width, int height);

  /** Returns a new transparent tile canvas with {@code image} drawn at {@code (offsetX, offsetY)}. */
  BufferedImage compositeOnCanvas(BufferedImage image, int offsetX, int offsetY);

  /** Returns a new fully transparent tile canvas. */
  BufferedImage blankCanvas();

  /** Returns the bytes of {@code image} in the output tile format. */
  byte[] encode(BufferedImage image) throws IOException;
}
