package com.onthegomap.tilegen.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, handling interrupts and wrapping in a {@link FatalTilegenException} if checked.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalTilegenException(exception);
  }

  /** Returns a one-line description of {@code exception} suitable for a per-tile failure reason. */
  public static String describe(Throwable exception) {
    String message = exception.getMessage();
    String type = exception.getClass().getSimpleName();
    return message == null || message.isBlank() ? type : (type + ": " + message);
  }

  /**
   * Fatal exception that will result in tilegen exiting early and shutting down.
   */
  public static class FatalTilegenException extends RuntimeException {
    public FatalTilegenException(Throwable exception) {
      super(exception);
    }
  }
}
