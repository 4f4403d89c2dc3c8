package com.onthegomap.tilegen.imaging;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;
import javax.annotation.concurrent.ThreadSafe;

/**
 * {@link ImageProcessor} backed by Java2D over a source image decoded once up front.
 * <p>
 * Workers only read from the shared source raster; every method returns a new image owned by the caller.
 */
@ThreadSafe
public class Java2dImageProcessor implements ImageProcessor {

  private final BufferedImage source;
  private final int tileSize;
  private final TileEncoder encoder;

  public Java2dImageProcessor(BufferedImage source, int tileSize, TileEncoder encoder) {
    this.source = Objects.requireNonNull(source);
    this.tileSize = tileSize;
    this.encoder = Objects.requireNonNull(encoder);
  }

  public int width() {
    return source.getWidth();
  }

  public int height() {
    return source.getHeight();
  }

  @Override
  public BufferedImage extractRegion(int sx, int sy, int sw, int sh) {
    return source.getSubimage(sx, sy, sw, sh);
  }

  @Override
  public BufferedImage resample(BufferedImage image, int width, int height) {
    BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = result.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
      g.setComposite(AlphaComposite.Src);
      g.drawImage(image, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }
    return result;
  }

  @Override
  public BufferedImage compositeOnCanvas(BufferedImage image, int offsetX, int offsetY) {
    BufferedImage canvas = blankCanvas();
    Graphics2D g = canvas.createGraphics();
    try {
      g.setComposite(AlphaComposite.SrcOver);
      g.drawImage(image, offsetX, offsetY, null);
    } finally {
      g.dispose();
    }
    return canvas;
  }

  @Override
  public BufferedImage blankCanvas() {
    return new BufferedImage(tileSize, tileSize, BufferedImage.TYPE_INT_ARGB);
  }

  @Override
  public byte[] encode(BufferedImage image) throws IOException {
    return encoder.encode(image);
  }
}
