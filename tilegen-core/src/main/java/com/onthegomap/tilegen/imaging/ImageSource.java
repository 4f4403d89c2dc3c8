package com.onthegomap.tilegen.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads source images from disk.
 */
public class ImageSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageSource.class);

  private ImageSource() {}

  /**
   * Returns the dimensions of the image at {@code path} by reading only its header.
   *
   * @throws InvalidImageException if the file is missing, is not a supported image, or has zero width or height
   */
  public static ImageDimensions probe(Path path) throws InvalidImageException {
    if (!Files.isRegularFile(path)) {
      throw new InvalidImageException("Input image " + path + " does not exist");
    }
    try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
      if (input == null) {
        throw new InvalidImageException("Unable to open " + path);
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
      if (!readers.hasNext()) {
        throw new InvalidImageException("Unsupported image format: " + path);
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);
        LOGGER.debug("Probed {} with {}: {}x{}", path, reader.getFormatName(), width, height);
        if (width <= 0 || height <= 0) {
          throw new InvalidImageException("Invalid image dimensions " + width + "x" + height + " in " + path);
        }
        return new ImageDimensions(width, height);
      } finally {
        reader.dispose();
      }
    } catch (InvalidImageException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidImageException("Unable to read image header from " + path, e);
    }
  }

  /**
   * Decodes the whole image at {@code path} into memory.
   *
   * @throws InvalidImageException if the file cannot be decoded
   */
  public static BufferedImage decode(Path path) throws InvalidImageException {
    BufferedImage image;
    try {
      image = ImageIO.read(path.toFile());
    } catch (IOException e) {
      throw new InvalidImageException("Unable to decode " + path, e);
    }
    if (image == null) {
      throw new InvalidImageException("Unsupported image format: " + path);
    }
    return image;
  }
}
