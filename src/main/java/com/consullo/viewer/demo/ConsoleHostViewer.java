package com.consullo.viewer.demo;

import com.consullo.viewer.core.EditMode;
import com.consullo.viewer.core.HostViewer;
import com.consullo.viewer.core.InMemoryLineSource;
import com.consullo.viewer.core.LineSource;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;

/**
 * Minimal {@link HostViewer} that prints its viewport to a stream.
 *
 * <p>Repaint requests are counted so the demo can wait for a window reload after a placeholder render.
 */
final class ConsoleHostViewer implements HostViewer {

  private final PrintStream out;
  private final int viewportSize;
  private final Semaphore repaints = new Semaphore(0);

  private volatile EditMode editMode = EditMode.WRITE;
  private volatile LineSource lineSource = new InMemoryLineSource(new ArrayList<>());
  private volatile int viewportStart;

  ConsoleHostViewer(final PrintStream out, final int viewportSize) {
    Validate.notNull(out, "out must not be null");
    Validate.isTrue(viewportSize > 0, "viewportSize must be positive");
    this.out = out;
    this.viewportSize = viewportSize;
  }

  @Override
  public int viewportSize() {
    return viewportSize;
  }

  @Override
  public EditMode editMode() {
    return editMode;
  }

  @Override
  public void editMode(final EditMode mode) {
    this.editMode = mode;
  }

  @Override
  public LineSource lineSource() {
    return lineSource;
  }

  @Override
  public void lineSource(final LineSource source) {
    Validate.notNull(source, "source must not be null");
    this.lineSource = source;
  }

  @Override
  public void render(final boolean full) {
    repaints.release();
  }

  void scrollTo(final int start) {
    this.viewportStart = start;
  }

  /**
   * Prints the current viewport, waiting for pending reloads when placeholders come back.
   *
   * @param placeholder loading placeholder to wait out
   * @param timeoutMillis maximum time to wait for a repaint
   * @throws InterruptedException if interrupted while waiting
   */
  void printViewport(final String placeholder, final long timeoutMillis) throws InterruptedException {
    repaints.drainPermits();
    List<String> lines = lineSource.readLines(viewportStart, viewportSize);
    while (!lines.isEmpty() && placeholder.equals(lines.get(0)) && lineSource.lineCount() > 0) {
      if (!repaints.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS)) {
        break;
      }
      lines = lineSource.readLines(viewportStart, viewportSize);
    }

    out.println("--- lines " + viewportStart + ".." + (viewportStart + viewportSize - 1)
        + " of " + lineSource.lineCount() + " [" + editMode + "]");
    for (int i = 0; i < lines.size(); i++) {
      out.printf("%8d | %s%n", viewportStart + i, lines.get(i));
    }
  }
}
