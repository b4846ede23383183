package com.consullo.viewer.core;

import java.util.List;

/**
 * Read-only source of document lines consulted by the hosting viewer on every repaint.
 *
 * <p>The viewer holds a reference to exactly one active source. The normal source serves an in-memory line
 * list; the chunked source serves lines from compressed storage and may answer with placeholders while a
 * window reload is in flight, in which case a repaint notification follows.
 *
 * @since 1.0
 */
public interface LineSource {

  /**
   * Returns the number of lines in the document.
   *
   * @return line count
   */
  int lineCount();

  /**
   * Reads the lines of a viewport.
   *
   * <p>Positions past the end of the document are returned as empty strings, so the result always holds
   * exactly {@code size} elements.
   *
   * @param start absolute index of the first visible line
   * @param size number of visible lines
   * @return display strings for the viewport
   */
  List<String> readLines(int start, int size);

  /**
   * Returns the index of the last line, or -1 for an empty document.
   */
  default int lastIndex() {
    return lineCount() - 1;
  }
}
