package com.onthegomap.tilegen.imaging;

/** Pixel width and height of a source image. */
public record ImageDimensions(int width, int height) {

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
