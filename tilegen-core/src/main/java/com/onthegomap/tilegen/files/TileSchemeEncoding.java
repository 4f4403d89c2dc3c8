package com.onthegomap.tilegen.files;

import com.onthegomap.tilegen.pyramid.TileTask;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps a tile to its file under the output directory using a path template.
 * <p>
 * The template may use {@code {z}}, {@code {x}}, {@code {y}} and {@code {ext}}. {@code {xs}} and {@code {ys}} can be
 * used in place of {@code {x}} and {@code {y}} to split a zero-padded 6 digit coordinate over two folders, so that no
 * folder ends up with more than 1000 entries:
 * <ul>
 * <li>{@code {z}/{x}/{y}.{ext}} gives {@code 3/1/2.png}</li>
 * <li>{@code {x}-{y}-{z}.{ext}} gives {@code 1-2-3.png}</li>
 * <li>{@code {z}/{xs}/{ys}.{ext}} gives {@code 3/000/001/000/002.png}</li>
 * </ul>
 *
 * @param tileScheme the path template, relative to {@code basePath}
 * @param basePath   the output directory
 * @param extension  the value of {@code {ext}}, without a leading dot
 */
public record TileSchemeEncoding(String tileScheme, Path basePath, String extension) {

  public static final String DEFAULT_SCHEME = "{z}/{x}/{y}.{ext}";

  private static final String Z = "{z}";
  private static final String X = "{x}";
  private static final String Y = "{y}";
  private static final String X_SPLIT = "{xs}";
  private static final String Y_SPLIT = "{ys}";
  private static final String EXT = "{ext}";

  /**
   * @throws IllegalArgumentException if the template is absolute or does not name the zoom and each coordinate
   *                                  exactly once
   */
  public TileSchemeEncoding {
    if (Path.of(tileScheme).isAbsolute()) {
      throw new IllegalArgumentException("tile scheme must be a relative path, was " + tileScheme);
    }
    if (StringUtils.countMatches(tileScheme, Z) != 1 ||
      StringUtils.countMatches(tileScheme, X) + StringUtils.countMatches(tileScheme, X_SPLIT) != 1 ||
      StringUtils.countMatches(tileScheme, Y) + StringUtils.countMatches(tileScheme, Y_SPLIT) != 1) {
      throw new IllegalArgumentException("tile scheme must contain {z}, one of {x} or {xs}, and one of {y} or {ys}, was "
        + tileScheme);
    }
  }

  /** Returns the file that {@code task} is written to. */
  public Path path(TileTask task) {
    String relative = tileScheme
      .replace(EXT, extension)
      .replace(Z, Integer.toString(task.z()))
      .replace(X, Integer.toString(task.x()))
      .replace(Y, Integer.toString(task.y()))
      .replace(X_SPLIT, split(task.x()))
      .replace(Y_SPLIT, split(task.y()));
    return basePath.resolve(relative);
  }

  private static String split(int coordinate) {
    String digits = "%06d".formatted(coordinate);
    return Path.of(digits.substring(0, 3), digits.substring(3)).toString();
  }
}
