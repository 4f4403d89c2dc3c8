package com.onthegomap.tilegen.pyramid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PyramidConfigTest {

  private final PyramidConfig config = PyramidPlanner.plan(256, 1, 1000, 600);

  @Test
  void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> new PyramidConfig(0, 1, 10, 10, 0));
    assertThrows(IllegalArgumentException.class, () -> new PyramidConfig(256, 0, 10, 10, 0));
    assertThrows(InvalidDimensionsException.class, () -> new PyramidConfig(256, 1, 0, 10, 0));
    assertThrows(IllegalArgumentException.class, () -> new PyramidConfig(256, 1, 10, 10, -1));
  }

  @Test
  void testFullInteriorTile() {
    assertEquals(new SourceWindow(256, 256, 256, 256, 0, 0, 256, 256), config.window(new TileTask(2, 1, 1)));
  }

  @Test
  void testRightEdgeTileIsClamped() {
    // columns 768..1024 at z2, image ends at 1000
    var window = config.window(new TileTask(2, 3, 0));
    assertEquals(768, window.sx());
    assertEquals(232, window.sw());
    assertEquals(256, window.sh());
    assertEquals(232, window.targetWidth());
    assertEquals(256, window.targetHeight());
    assertEquals(0, window.offsetX());
    assertFalse(window.isEmpty());
  }

  @Test
  void testBottomEdgeTileIsClamped() {
    // rows 512..768 at z2, image ends at 600
    var window = config.window(new TileTask(2, 0, 2));
    assertEquals(512, window.sy());
    assertEquals(88, window.sh());
    assertEquals(88, window.targetHeight());
  }

  @Test
  void testDownsampledLevel() {
    // z0 covers 1024x1024 source pixels in one 256px tile
    var window = config.window(new TileTask(0, 0, 0));
    assertEquals(new SourceWindow(0, 0, 1000, 600, 0, 0, 250, 150), window);
    // z1 second column covers 512..1000
    var z1 = config.window(new TileTask(1, 1, 1));
    assertEquals(new SourceWindow(512, 512, 488, 88, 0, 0, 244, 44), z1);
  }

  @Test
  void testTileOutsideImageIsEmpty() {
    var window = config.window(new TileTask(2, 4, 0));
    assertTrue(window.sw() <= 0);
    assertTrue(window.isEmpty());
    assertEquals(0, window.targetWidth());
  }

  @Test
  void testMagnifiedLevel() {
    var magnified = PyramidPlanner.plan(256, 2, 300, 200);
    assertEquals(2, magnified.maxZoom());
    // 128 source px per tile at z2, each source pixel drawn 2x2
    var window = magnified.window(new TileTask(2, 2, 1));
    assertEquals(new SourceWindow(256, 128, 44, 72, 0, 0, 88, 144), window);
  }

  @Test
  void testTinySliverStillResamplesToOnePixel() {
    // 1px wide image edge at a level where one tile spans 1024 source pixels
    var wide = PyramidPlanner.plan(256, 1, 1025, 10);
    assertEquals(3, wide.maxZoom());
    var window = wide.window(new TileTask(1, 1, 0));
    assertEquals(1, window.sw());
    assertEquals(1, window.targetWidth());
  }
}
