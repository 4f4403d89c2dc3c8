package com.onthegomap.tilegen.pyramid;

/**
 * One output tile at zoom {@code z}, column {@code x}, row {@code y}.
 */
public record TileTask(int z, int x, int y) {

  public TileTask {
    if (z < 0 || x < 0 || y < 0) {
      throw new IllegalArgumentException("Invalid tile " + z + "/" + x + "/" + y);
    }
  }

  @Override
  public String toString() {
    return z + "/" + x + "/" + y;
  }
}
