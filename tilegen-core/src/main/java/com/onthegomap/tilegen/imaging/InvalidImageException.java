package com.onthegomap.tilegen.imaging;

import java.io.IOException;

/** Thrown when a source image cannot be read or reports unusable dimensions. */
public class InvalidImageException extends IOException {

  public InvalidImageException(String message) {
    super(message);
  }

  public InvalidImageException(String message, Throwable cause) {
    super(message, cause);
  }
}
