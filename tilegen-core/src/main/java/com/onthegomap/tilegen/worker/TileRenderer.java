package com.onthegomap.tilegen.worker;

import com.onthegomap.tilegen.files.WriteableFilesArchive;
import com.onthegomap.tilegen.imaging.ImageProcessor;
import com.onthegomap.tilegen.pyramid.PyramidConfig;
import com.onthegomap.tilegen.pyramid.SourceWindow;
import com.onthegomap.tilegen.pyramid.TileTask;
import com.onthegomap.tilegen.stats.Stats;
import java.awt.image.BufferedImage;
import java.io.IOException;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Cuts the source region for a tile out of the image, scales it to tile resolution, places it on a transparent canvas
 * and writes the encoded result.
 * <p>
 * Tiles that cover no source pixels get a blank tile that is encoded once up front.
 */
@ThreadSafe
public class TileRenderer implements TileHandler {

  private final PyramidConfig config;
  private final ImageProcessor processor;
  private final WriteableFilesArchive archive;
  private final Stats stats;
  private final byte[] blankTile;

  /**
   * @throws IOException if the blank tile cannot be encoded, meaning no tile in this format can be
   */
  public TileRenderer(PyramidConfig config, ImageProcessor processor, WriteableFilesArchive archive, Stats stats)
    throws IOException {
    this.config = config;
    this.processor = processor;
    this.archive = archive;
    this.stats = stats;
    this.blankTile = processor.encode(processor.blankCanvas());
  }

  @Override
  public void handle(TileTask task) throws IOException {
    byte[] bytes = render(task);
    archive.write(task, bytes);
    stats.wroteTile(task.z(), bytes.length);
  }

  /** Returns the encoded bytes for {@code task} without writing them. */
  public byte[] render(TileTask task) throws IOException {
    SourceWindow window = config.window(task);
    if (window.isEmpty()) {
      return blankTile;
    }
    BufferedImage region = processor.extractRegion(window.sx(), window.sy(), window.sw(), window.sh());
    BufferedImage scaled = processor.resample(region, window.targetWidth(), window.targetHeight());
    BufferedImage tile = processor.compositeOnCanvas(scaled, window.offsetX(), window.offsetY());
    return processor.encode(tile);
  }

  byte[] blankTile() {
    return blankTile;
  }
}
