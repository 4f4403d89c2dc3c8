package com.onthegomap.tilegen.worker;

import com.onthegomap.tilegen.pyramid.TileTask;

/** Renders and persists a single tile. Called concurrently from every worker thread. */
@FunctionalInterface
public interface TileHandler {

  @SuppressWarnings("java:S112")
  void handle(TileTask task) throws Exception;
}
