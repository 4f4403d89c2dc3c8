package com.onthegomap.tilegen.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;

/** Serializes a rendered tile canvas into the bytes of an image file. */
@FunctionalInterface
public interface TileEncoder {

  byte[] encode(BufferedImage image) throws IOException;
}
