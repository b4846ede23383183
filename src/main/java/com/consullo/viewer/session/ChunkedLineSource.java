package com.consullo.viewer.session;

import com.consullo.viewer.core.LineSource;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Line source serving a {@link ChunkedSession}: the line count comes from the chunk store and viewport
 * reads go through the window.
 *
 * @since 1.0
 */
public final class ChunkedLineSource implements LineSource {

  private final ChunkedSession session;

  public ChunkedLineSource(final ChunkedSession session) {
    Validate.notNull(session, "session must not be null");
    this.session = session;
  }

  @Override
  public int lineCount() {
    return session.store().totalLines();
  }

  @Override
  public List<String> readLines(final int start, final int size) {
    return session.window().resolve(start, size);
  }
}
