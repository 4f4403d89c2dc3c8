package com.onthegomap.tilegen.imaging;

import static com.onthegomap.tilegen.TestUtils.assertTransparent;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.onthegomap.tilegen.TestUtils;
import java.awt.image.BufferedImage;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class Java2dImageProcessorTest {

  private final BufferedImage source = TestUtils.gradient(10, 8);
  private final Java2dImageProcessor processor = new Java2dImageProcessor(source, 16, image -> new byte[]{1, 2, 3});

  @Test
  void testDimensions() {
    assertEquals(10, processor.width());
    assertEquals(8, processor.height());
  }

  @Test
  void testExtractRegion() {
    var region = processor.extractRegion(3, 2, 4, 5);
    assertEquals(4, region.getWidth());
    assertEquals(5, region.getHeight());
    assertEquals(source.getRGB(3, 2), region.getRGB(0, 0));
    assertEquals(source.getRGB(6, 6), region.getRGB(3, 4));
  }

  @Test
  void testResampleUpUsesNearestNeighbour() {
    var region = processor.extractRegion(0, 0, 2, 2);
    var scaled = processor.resample(region, 4, 4);
    assertEquals(4, scaled.getWidth());
    assertEquals(4, scaled.getHeight());
    for (int x = 0; x < 4; x++) {
      for (int y = 0; y < 4; y++) {
        assertEquals(source.getRGB(x / 2, y / 2), scaled.getRGB(x, y), "pixel " + x + "," + y);
      }
    }
  }

  @Test
  void testResampleKeepsTransparency() {
    var image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(0, 0, 0x80ff0000);
    var scaled = processor.resample(image, 4, 2);
    assertEquals(0x80, scaled.getRGB(0, 0) >>> 24);
    assertEquals(0, scaled.getRGB(3, 1) >>> 24);
  }

  @Test
  void testBlankCanvas() {
    var canvas = processor.blankCanvas();
    assertEquals(16, canvas.getWidth());
    assertEquals(16, canvas.getHeight());
    assertTransparent(canvas);
  }

  @Test
  void testCompositeOnCanvas() {
    var region = processor.extractRegion(0, 0, 4, 3);
    var canvas = processor.compositeOnCanvas(region, 5, 6);
    assertEquals(16, canvas.getWidth());
    assertEquals(16, canvas.getHeight());
    assertEquals(source.getRGB(0, 0), canvas.getRGB(5, 6));
    assertEquals(source.getRGB(3, 2), canvas.getRGB(8, 8));
    assertEquals(0, canvas.getRGB(4, 6) >>> 24);
    assertEquals(0, canvas.getRGB(9, 6) >>> 24);
    assertEquals(0, canvas.getRGB(5, 9) >>> 24);
    assertEquals(0, canvas.getRGB(15, 15) >>> 24);
  }

  @Test
  void testEncodeDelegatesToEncoder() throws IOException {
    assertArrayEquals(new byte[]{1, 2, 3}, processor.encode(processor.blankCanvas()));
  }
}
