package com.onthegomap.tilegen;

/** Exception thrown on purpose from tests so it can be told apart from real failures. */
public class ExpectedException extends RuntimeException {

  public ExpectedException() {
    super("expected exception", null, true, false);
  }
}
