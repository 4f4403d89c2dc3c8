package com.onthegomap.tilegen.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.tilegen.TestUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ArgumentsTest {

  @Test
  void testMissingKeyUsesDefault() {
    var args = Arguments.of();
    assertEquals("fallback", args.getString("key", "key", "fallback"));
    assertEquals(7, args.getInteger("key", "key", 7));
    assertEquals(Path.of("x"), args.file("key", "key", Path.of("x")));
    assertNull(args.getDuration("key", "key", null));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("tile_size", "512", "max_mag", "2")
      .orElse(Arguments.of("max_mag", "4", "tile_format", "jpg"));

    assertEquals(512, args.getInteger("tile_size", "size", 256));
    assertEquals(2, args.getInteger("max_mag", "mag", 1));
    assertEquals("jpg", args.getString("tile_format", "format", "png"));
    assertEquals("fallback", args.getString("input", "input", "fallback"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"tile_size", "tile-size", "TILE_SIZE", "tile.size", "--tile_size"})
  void testKeysAreNormalized(String key) {
    assertEquals(512, Arguments.of(key, "512").getInteger("tile_size", "size", 256));
    assertEquals(512, Arguments.of("tile_size", "512").getInteger(key, "size", 256));
  }

  @Test
  void testArgForms() {
    Arguments args = Arguments.fromArgs("input=a.png", "--output=out", "--tile_size", "512", "--allow_tile_failures",
      "--threads", "2");

    assertEquals("a.png", args.getString("input", "input", null));
    assertEquals("out", args.getString("output", "output", null));
    assertEquals(512, args.getInteger("tile_size", "size", 256));
    assertTrue(args.getBoolean("allow_tile_failures", "allow", false));
    assertEquals(2, args.threads());
  }

  @Test
  void testNegativeNumberAfterKeyIsItsValue() {
    Arguments args = Arguments.fromArgs("--png_compression", "-1", "--offset", "-0.5", "--force", "-z");
    assertEquals(-1, args.getInteger("png_compression", "level", 6));
    assertEquals(-0.5, args.getDouble("offset", "offset", 0));
    assertTrue(args.getBoolean("force", "force", false));
    assertTrue(args.getBoolean("z", "z", false));
  }

  @Test
  void testTrailingFlagIsTrue() {
    assertTrue(Arguments.fromArgs("--tile_size=8", "--help").getBoolean("help", "help", false));
  }

  @Test
  void testValueMayContainEquals() {
    assertEquals("a=b", Arguments.fromArgs("--tile_scheme=a=b").getString("tile_scheme", "scheme", null));
  }

  @Test
  void testValuesAreStripped() {
    assertEquals(512, Arguments.of("tile_size", " 512 ").getInteger("tile_size", "size", 256));
  }

  @Test
  void testEnvironment() {
    Map<String, String> env = Map.of(
      "TILE_SIZE", "1",
      "TILEGENTILE_SIZE", "2",
      "TILEGEN_TILE_SIZE", "128"
    );
    assertEquals(128, Arguments.fromEnvironment(env).getInteger("tile_size", "size", 256));
    assertEquals(128, Arguments.fromEnvironment(env).getInteger("tile-size", "size", 256));
    assertEquals(1, Arguments.fromEnvironment(env).getInteger("max_mag", "mag", 1));
  }

  @Test
  void testJvmProperties() {
    Properties properties = new Properties();
    properties.setProperty("tile_size", "1");
    properties.setProperty("tilegen.tile_size", "64");
    assertEquals(64, Arguments.fromJvmProperties(properties).getInteger("tile_size", "size", 256));
  }

  @Test
  void testArgsTakePrecedenceOverEnvironment() {
    Map<String, String> env = Map.of("TILEGEN_TILE_SIZE", "128", "TILEGEN_MAX_MAG", "2");
    Arguments args = Arguments.fromArgs("--tile_size=512").orElse(Arguments.fromEnvironment(env));
    assertEquals(512, args.getInteger("tile_size", "size", 256));
    assertEquals(2, args.getInteger("max_mag", "mag", 1));
  }

  @Test
  void testConfigFile() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testMissingConfigFile() {
    var path = Path.of("does-not-exist.properties");
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromConfigFile(path));
  }

  @Test
  void testConfigFileNamedOnCommandLine() {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "--config=" + TestUtils.pathToResource("test.properties"),
      "key2=value2fromargs"
    );

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("value2fromargs", args.getString("key2", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testDuration() {
    Arguments args = Arguments.of("timeout", "1h30m", "bad", "soon");

    assertEquals(Duration.ofMinutes(90), args.getDuration("timeout", "timeout", Duration.ofMinutes(10)));
    assertEquals(Duration.ofSeconds(10), args.getDuration("log_interval", "interval", Duration.ofSeconds(10)));
    var e = assertThrows(IllegalArgumentException.class, () -> args.getDuration("bad", "bad", null));
    assertTrue(e.getMessage().contains("bad"), e.getMessage());
  }

  @Test
  void testNumbers() {
    Arguments args = Arguments.of("tile_size", "30", "max_mag", "3x", "jpeg_quality", "0.5");

    assertEquals(30, args.getInteger("tile_size", "size", 10));
    assertEquals(0.5, args.getDouble("jpeg_quality", "quality", 0.9));
    assertEquals(0.9, args.getDouble("webp_quality", "quality", 0.9));
    var e = assertThrows(IllegalArgumentException.class, () -> args.getInteger("max_mag", "mag", 1));
    assertEquals("max_mag must be an integer, was '3x'", e.getMessage());
  }

  @Test
  void testBoolean() {
    assertTrue(Arguments.of("flag", "TRUE").getBoolean("flag", "flag", false));
    assertFalse(Arguments.of("flag", "false").getBoolean("flag", "flag", true));
    assertFalse(Arguments.of().getBoolean("flag", "flag", false));
    var args = Arguments.of("flag", "yes please");
    assertThrows(IllegalArgumentException.class, () -> args.getBoolean("flag", "flag", false));
  }

  @Test
  void testThreads() {
    assertEquals(2, Arguments.of("threads", "2").threads());
    assertTrue(Arguments.of().threads() > 0);
    var zero = Arguments.of("threads", "0");
    assertThrows(IllegalArgumentException.class, zero::threads);
  }

  @Test
  void testExactlyOnceLoggingStillReturnsValues() {
    Arguments args = Arguments.of("key", "value").withExactlyOnceLogging().orElse(Arguments.of("other", "x"));
    for (int i = 0; i < 5; i++) {
      assertEquals("value", args.getString("key", "key", null));
      assertEquals("x", args.getString("other", "other", null));
    }
  }
}
