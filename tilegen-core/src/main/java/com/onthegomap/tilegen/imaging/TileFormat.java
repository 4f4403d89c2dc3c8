package com.onthegomap.tilegen.imaging;

import com.luciad.imageio.webp.WebPWriteParam;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageWriteParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output image formats tiles can be written in.
 */
public enum TileFormat {
  PNG("png", "image/png") {
    @Override
    public TileEncoder newEncoder(EncoderOptions options) {
      return new PngTileEncoder(options.pngCompression());
    }
  },
  JPG("jpg", "image/jpeg") {
    @Override
    public TileEncoder newEncoder(EncoderOptions options) {
      return new ImageIoTileEncoder(mimeType(), true, param -> {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(options.jpegQuality());
      });
    }
  },
  WEBP("webp", "image/webp") {
    @Override
    public TileEncoder newEncoder(EncoderOptions options) {
      return new ImageIoTileEncoder(mimeType(), false, param -> {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionType(param.getCompressionTypes()[WebPWriteParam.LOSSY_COMPRESSION]);
        param.setCompressionQuality(options.webpQuality());
      });
    }
  };

  private static final Logger LOGGER = LoggerFactory.getLogger(TileFormat.class);

  private final String extension;
  private final String mimeType;

  TileFormat(String extension, String mimeType) {
    this.extension = extension;
    this.mimeType = mimeType;
  }

  /** File extension without the leading dot. */
  public String extension() {
    return extension;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Returns a new encoder for tiles in this format. */
  public abstract TileEncoder newEncoder(EncoderOptions options);

  /** Returns the format named {@code name} (case-insensitive, {@code jpeg} is an alias for {@code jpg}). */
  public static Optional<TileFormat> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.strip().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    if ("jpeg".equals(normalized)) {
      normalized = "jpg";
    }
    for (TileFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Returns the format named {@code name}, or {@link #PNG} with a warning if it is not supported. */
  public static TileFormat parseOrDefault(String name) {
    return find(name).orElseGet(() -> {
      LOGGER.warn("Unsupported tile format '{}', falling back to png", name);
      return PNG;
    });
  }
}
