package com.onthegomap.tilegen.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Filesystem helpers for the tile output tree. Failures surface as {@link UncheckedIOException}.
 */
public final class FileUtils {

  private FileUtils() {}

  /**
   * Creates {@code dir} and any missing parents.
   *
   * @return {@code true} if the directory was created, {@code false} if it already existed
   * @throws UncheckedIOException if it cannot be created or something other than a directory is in the way
   */
  public static boolean createDirectory(Path dir) {
    if (Files.isDirectory(dir)) {
      return false;
    }
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create directories " + dir, e);
    }
    return true;
  }

  /** Creates the directory that will hold {@code file} if it is missing. */
  public static void createParentDirectories(Path file) {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      createDirectory(parent);
    }
  }

  /**
   * Writes {@code bytes} to {@code file}, replacing what was there. The parent directory must exist.
   *
   * @throws UncheckedIOException if the write fails
   */
  public static void write(Path file, byte[] bytes) {
    try {
      Files.write(file, bytes);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + file, e);
    }
  }

  /** Returns the total size in bytes of a file, or of every file under a directory, or 0 if it does not exist. */
  public static long size(Path path) {
    if (!Files.exists(path)) {
      return 0;
    }
    try (Stream<Path> files = Files.walk(path)) {
      return files.filter(Files::isRegularFile).mapToLong(file -> file.toFile().length()).sum();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to measure " + path, e);
    }
  }
}
