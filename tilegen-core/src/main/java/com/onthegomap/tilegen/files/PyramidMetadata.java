package com.onthegomap.tilegen.files;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.onthegomap.tilegen.imaging.TileFormat;
import com.onthegomap.tilegen.pyramid.PyramidConfig;

/** Description of a generated pyramid written next to the tiles as JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PyramidMetadata(
  int tileSize,
  int maxMagnification,
  int width,
  int height,
  int minZoom,
  int maxZoom,
  String format,
  String tileScheme,
  long tileCount,
  String generator
) {

  public static PyramidMetadata of(PyramidConfig config, TileFormat format, String tileScheme, long tileCount,
    String generator) {
    return new PyramidMetadata(
      config.tileSize(),
      config.maxMagnification(),
      config.imageWidth(),
      config.imageHeight(),
      0,
      config.maxZoom(),
      format.extension(),
      tileScheme,
      tileCount,
      generator
    );
  }
}
