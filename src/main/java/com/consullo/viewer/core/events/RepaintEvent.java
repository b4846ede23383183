package com.consullo.viewer.core.events;

/**
 * Tells the hosting viewer that content it may have rendered as placeholders is now available.
 *
 * @param chunkIndex chunk whose window finished loading
 * @since 1.0
 */
public record RepaintEvent(int chunkIndex) {

  /**
   * Creates an event for a completed window load.
   *
   * @param chunkIndex chunk now resident as the current buffer
   * @return window loaded event
   */
  public static RepaintEvent windowLoaded(int chunkIndex) {
    return new RepaintEvent(chunkIndex);
  }
}
