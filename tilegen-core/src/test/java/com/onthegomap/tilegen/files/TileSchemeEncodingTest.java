package com.onthegomap.tilegen.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.tilegen.pyramid.TileTask;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TileSchemeEncodingTest {

  @ParameterizedTest
  @CsvSource(textBlock = """
    {z}/{x}/{y}.{ext},    3/1/2.png
    {x}/{y}/{z}.{ext},    1/2/3.png
    {x}-{y}-{z}.{ext},    1-2-3.png
    {x}/a/{y}/b{z}.{ext}, 1/a/2/b3.png
    {z}/{x}/{y}.png,      3/1/2.png
    {z}/{x}/{y}.{ext}.gz, 3/1/2.png.gz
    {z}/{xs}/{ys}.{ext},  3/000/001/000/002.png
    {z}/{x}/{ys}.{ext},   3/1/000/002.png
    {z}/{xs}/{y}.{ext},   3/000/001/2.png
    """
  )
  void testEncoder(String tileScheme, Path tilePath, @TempDir Path tempDir) {
    final Path tilesDir = tempDir.resolve("tiles");
    tilePath = tilesDir.resolve(tilePath);
    assertEquals(
      tilePath,
      new TileSchemeEncoding(tileScheme, tilesDir, "png").path(new TileTask(3, 1, 2))
    );
  }

  @Test
  void testExtensionFollowsFormat(@TempDir Path tempDir) {
    var encoding = new TileSchemeEncoding(TileSchemeEncoding.DEFAULT_SCHEME, tempDir, "webp");
    assertEquals(tempDir.resolve(Paths.get("0", "0", "0.webp")), encoding.path(new TileTask(0, 0, 0)));
  }

  @Test
  void testLargeSafeCoordinates(@TempDir Path tempDir) {
    var encoding = new TileSchemeEncoding("{z}/{xs}/{ys}.{ext}", tempDir, "jpg");
    assertEquals(tempDir.resolve(Paths.get("20", "123", "456", "000", "007.jpg")),
      encoding.path(new TileTask(20, 123456, 7)));
  }

  @ParameterizedTest
  @CsvSource(textBlock = """
    1/2/3.png
    {x}/{y}.png
    {z}/{y}.png
    {z}/{x}
    {z}/{x}/1.png
    {z}/{x}/{y}/{xs}.png
    {z}/{x}/{y}/{ys}.png
    {z}/{z}/{x}/{y}.png
    {x}/{z}/{x}/{y}.png
    {y}/{z}/{x}/{y}.png
    {xs}/{z}/{xs}/{ys}.png
    {ys}/{z}/{xs}/{ys}.png
    """
  )
  void testInvalidSchemes(String tileScheme, @TempDir Path tempDir) {
    final Path tilesDir = tempDir.resolve("tiles");
    assertThrows(IllegalArgumentException.class, () -> new TileSchemeEncoding(tileScheme, tilesDir, "png"));
  }

  @Test
  void testInvalidAbsoluteTileScheme(@TempDir Path tempDir) {
    final Path tilesDir = tempDir.resolve("tiles");
    final String tileSchemeAbsolute =
      tilesDir.resolve(Paths.get("{z}", "{x}", "{y}.{ext}")).toAbsolutePath().toString();
    assertThrows(IllegalArgumentException.class, () -> new TileSchemeEncoding(tileSchemeAbsolute, tilesDir, "png"));
  }

  @Test
  void testEquality(@TempDir Path tempDir) {
    var a = new TileSchemeEncoding(TileSchemeEncoding.DEFAULT_SCHEME, tempDir, "png");
    var b = new TileSchemeEncoding(TileSchemeEncoding.DEFAULT_SCHEME, tempDir, "png");
    var c = new TileSchemeEncoding(TileSchemeEncoding.DEFAULT_SCHEME, tempDir, "jpg");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertEquals(TileSchemeEncoding.DEFAULT_SCHEME, a.tileScheme());
  }
}
