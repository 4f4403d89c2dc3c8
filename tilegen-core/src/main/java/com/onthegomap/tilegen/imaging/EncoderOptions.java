package com.onthegomap.tilegen.imaging;

/**
 * Format-specific encoder settings.
 *
 * @param pngCompression deflate level for PNG tiles, {@code -1} for the library default or {@code 0..9}
 * @param jpegQuality    JPEG quality in {@code [0, 1]}
 * @param webpQuality    lossy WebP quality in {@code [0, 1]}
 */
public record EncoderOptions(int pngCompression, float jpegQuality, float webpQuality) {

  public static final EncoderOptions DEFAULT = new EncoderOptions(-1, 0.9f, 0.9f);

  public EncoderOptions {
    if (pngCompression < -1 || pngCompression > 9) {
      throw new IllegalArgumentException("png_compression must be -1 or 0..9, was " + pngCompression);
    }
    checkQuality("jpeg_quality", jpegQuality);
    checkQuality("webp_quality", webpQuality);
  }

  private static void checkQuality(String name, float value) {
    if (!(value >= 0 && value <= 1)) {
      throw new IllegalArgumentException(name + " must be between 0 and 1, was " + value);
    }
  }
}
