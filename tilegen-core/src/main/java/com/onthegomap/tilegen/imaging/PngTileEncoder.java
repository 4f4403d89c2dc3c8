package com.onthegomap.tilegen.imaging;

import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;

/**
 * Writes tiles as 8-bit RGBA PNGs using PNGJ.
 */
public class PngTileEncoder implements TileEncoder {

  private final int compressionLevel;

  /** @param compressionLevel deflate level {@code 0..9}, or {@code -1} to keep the PNGJ default */
  public PngTileEncoder(int compressionLevel) {
    this.compressionLevel = compressionLevel;
  }

  @Override
  public byte[] encode(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    ImageInfo info = new ImageInfo(width, height, 8, true);
    var baos = new ByteArrayOutputStream();
    PngWriter writer = new PngWriter(baos, info);
    if (compressionLevel >= 0) {
      writer.setCompLevel(compressionLevel);
    }
    int[] argb = new int[width];
    for (int row = 0; row < height; row++) {
      image.getRGB(0, row, width, 1, argb, 0, width);
      ImageLineInt line = new ImageLineInt(info);
      int[] scanline = line.getScanline();
      for (int col = 0; col < width; col++) {
        int pixel = argb[col];
        int i = col * 4;
        scanline[i] = (pixel >> 16) & 0xff;
        scanline[i + 1] = (pixel >> 8) & 0xff;
        scanline[i + 2] = pixel & 0xff;
        scanline[i + 3] = (pixel >>> 24) & 0xff;
      }
      writer.writeRow(line);
    }
    writer.end();
    return baos.toByteArray();
  }
}
