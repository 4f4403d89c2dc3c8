package com.onthegomap.tilegen.imaging;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.function.Consumer;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * Writes tiles through the first {@link ImageWriter} registered for a MIME type.
 * <p>
 * {@link ImageWriter} instances are not thread safe so each call gets its own.
 */
public class ImageIoTileEncoder implements TileEncoder {

  private final String mimeType;
  private final boolean flattenAlpha;
  private final Consumer<ImageWriteParam> configureParam;

  /**
   * @param mimeType       output MIME type like {@code image/jpeg}
   * @param flattenAlpha   draw the tile onto an opaque black background first, for formats without transparency
   * @param configureParam sets quality options on each writer's default parameters
   */
  public ImageIoTileEncoder(String mimeType, boolean flattenAlpha, Consumer<ImageWriteParam> configureParam) {
    this.mimeType = mimeType;
    this.flattenAlpha = flattenAlpha;
    this.configureParam = configureParam;
  }

  /** Returns true if an {@link ImageWriter} for {@code mimeType} is registered. */
  public static boolean isSupported(String mimeType) {
    return ImageIO.getImageWritersByMIMEType(mimeType).hasNext();
  }

  @Override
  public byte[] encode(BufferedImage image) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(mimeType);
    if (!writers.hasNext()) {
      throw new IOException("No image writer registered for " + mimeType);
    }
    ImageWriter writer = writers.next();
    BufferedImage toWrite = flattenAlpha ? flatten(image) : image;
    var baos = new ByteArrayOutputStream();
    try (ImageOutputStream output = ImageIO.createImageOutputStream(baos)) {
      writer.setOutput(output);
      ImageWriteParam param = writer.getDefaultWriteParam();
      configureParam.accept(param);
      writer.write(null, new IIOImage(toWrite, null, null), param);
    } finally {
      writer.dispose();
    }
    return baos.toByteArray();
  }

  private static BufferedImage flatten(BufferedImage image) {
    BufferedImage result = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = result.createGraphics();
    try {
      g.setColor(Color.BLACK);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return result;
  }
}
