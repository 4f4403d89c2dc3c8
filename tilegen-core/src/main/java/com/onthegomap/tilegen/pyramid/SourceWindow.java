package com.onthegomap.tilegen.pyramid;

/**
 * The region of the source image one tile draws from, and where the resampled region lands on the tile canvas.
 *
 * @param sx           left edge in source pixels, clamped to the image
 * @param sy           top edge in source pixels, clamped to the image
 * @param sw           width in source pixels, {@code <= 0} when the tile lies outside the image
 * @param sh           height in source pixels, {@code <= 0} when the tile lies outside the image
 * @param offsetX      left edge of the resampled region on the tile canvas
 * @param offsetY      top edge of the resampled region on the tile canvas
 * @param targetWidth  width to resample the region to
 * @param targetHeight height to resample the region to
 */
public record SourceWindow(
  int sx, int sy, int sw, int sh,
  int offsetX, int offsetY,
  int targetWidth, int targetHeight
) {

  /** Returns true if this tile covers no source pixels and should be written as the blank tile. */
  public boolean isEmpty() {
    return sw <= 0 || sh <= 0;
  }
}
