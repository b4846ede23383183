package com.consullo.viewer.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Line source over a plain in-memory list, used while the viewer is in normal mode.
 *
 * @since 1.0
 */
public final class InMemoryLineSource implements LineSource {

  private final List<String> lines;

  /**
   * Creates a new source over the provided list. The list is not copied.
   *
   * @param lines backing line list
   */
  public InMemoryLineSource(final List<String> lines) {
    Validate.notNull(lines, "lines must not be null");
    this.lines = lines;
  }

  @Override
  public int lineCount() {
    return this.lines.size();
  }

  @Override
  public List<String> readLines(final int start, final int size) {
    if (start < 0) {
      throw new IllegalArgumentException("start must be non-negative");
    }
    if (size < 0) {
      throw new IllegalArgumentException("size must be non-negative");
    }

    final List<String> result = new ArrayList<>(size);
    for (int k = 0; k < size; k++) {
      final long position = (long) start + k;
      result.add(position < this.lines.size() ? this.lines.get((int) position) : "");
    }

    return Collections.unmodifiableList(result);
  }
}
