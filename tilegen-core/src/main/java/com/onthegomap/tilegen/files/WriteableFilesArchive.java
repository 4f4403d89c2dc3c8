package com.onthegomap.tilegen.files;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import com.onthegomap.tilegen.pyramid.TileTask;
import com.onthegomap.tilegen.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each tile to its own file under an output directory following a {@link TileSchemeEncoding}, plus an optional
 * {@code metadata.json} describing the pyramid.
 * <p>
 * Tile directories are created up front by {@link #createDirectories(Iterable)} so that concurrent writers never race
 * on directory creation. Existing directories are reused, so re-running over the same output only overwrites files.
 */
@ThreadSafe
public class WriteableFilesArchive {

  private static final Logger LOGGER = LoggerFactory.getLogger(WriteableFilesArchive.class);
  private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  public static final String NO_METADATA = "none";

  private final LongAdder bytesWritten = new LongAdder();
  private final Path basePath;
  private final Path metadataPath;
  private final TileSchemeEncoding encoding;

  private WriteableFilesArchive(Path basePath, TileSchemeEncoding encoding, Path metadataPath) {
    this.basePath = createValidateDirectory(basePath);
    this.metadataPath = metadataPath;
    if (metadataPath != null && Files.exists(metadataPath) && !Files.isRegularFile(metadataPath)) {
      throw new IllegalArgumentException("require " + metadataPath + " to be a regular file");
    }
    this.encoding = encoding;
    LOGGER.debug("Using {} as output directory with {}", basePath, encoding);
  }

  /**
   * Returns a writer for tiles under {@code basePath}.
   *
   * @param basePath         output directory, created if missing
   * @param encoding         maps each tile to its file
   * @param metadataPathRaw  where to write metadata relative to {@code basePath} (or absolute), or {@code "none"}
   * @throws UncheckedIOException     if {@code basePath} cannot be created
   * @throws IllegalArgumentException if {@code basePath} exists and is not a directory
   */
  public static WriteableFilesArchive newWriter(Path basePath, TileSchemeEncoding encoding, String metadataPathRaw) {
    return new WriteableFilesArchive(basePath, encoding, metadataPath(basePath, metadataPathRaw).orElse(null));
  }

  static Optional<Path> metadataPath(Path basePath, String metadataPathRaw) {
    if (metadataPathRaw == null || NO_METADATA.equals(metadataPathRaw)) {
      return Optional.empty();
    }
    Path p = Paths.get(metadataPathRaw);
    return Optional.of(p.isAbsolute() ? p : basePath.resolve(p));
  }

  /** Returns the file {@code task} is written to. */
  public Path tilePath(TileTask task) {
    return encoding.path(task);
  }

  /**
   * Creates the parent directory of every tile in {@code tasks} that does not exist yet.
   *
   * @return the number of directories that had to be created
   * @throws UncheckedIOException if a directory cannot be created
   */
  public int createDirectories(Iterable<TileTask> tasks) {
    int created = 0;
    Path lastCheckedFolder = null;
    for (TileTask task : tasks) {
      Path folder = tilePath(task).getParent();
      // consecutive tasks usually share a folder
      if (folder != null && !folder.equals(lastCheckedFolder)) {
        if (FileUtils.createDirectory(folder)) {
          created++;
        }
        lastCheckedFolder = folder;
      }
    }
    return created;
  }

  /**
   * Writes {@code data} as the file for {@code task}, replacing any previous version.
   *
   * @throws UncheckedIOException if the file cannot be written
   */
  public Path write(TileTask task, byte[] data) {
    Path file = tilePath(task);
    FileUtils.write(file, data);
    bytesWritten.add(data.length);
    return file;
  }

  /**
   * Writes {@code metadata} as JSON, overwriting the previous file. Does nothing if metadata is disabled.
   *
   * @return where the metadata was written, or empty if disabled
   */
  public Optional<Path> writeMetadata(PyramidMetadata metadata) {
    if (metadataPath == null) {
      return Optional.empty();
    }
    try {
      FileUtils.createParentDirectories(metadataPath);
      byte[] bytes = MAPPER.writeValueAsBytes(metadata);
      Files.write(metadataPath, bytes);
      bytesWritten.add(bytes.length);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return Optional.of(metadataPath);
  }

  public Path basePath() {
    return basePath;
  }

  public Optional<Path> metadataPath() {
    return Optional.ofNullable(metadataPath);
  }

  public long bytesWritten() {
    return bytesWritten.sum();
  }

  private static Path createValidateDirectory(Path p) {
    if (!Files.exists(p)) {
      FileUtils.createDirectory(p);
    }
    Preconditions.checkArgument(Files.isDirectory(p), "require \"" + p + "\" to be a directory");
    return p;
  }
}
