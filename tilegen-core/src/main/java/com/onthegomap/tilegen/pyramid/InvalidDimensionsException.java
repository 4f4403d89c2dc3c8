package com.onthegomap.tilegen.pyramid;

/** Thrown when a source image reports a width or height that cannot be tiled. */
public class InvalidDimensionsException extends IllegalArgumentException {

  public InvalidDimensionsException(int width, int height) {
    super("Invalid image dimensions " + width + "x" + height);
  }
}
