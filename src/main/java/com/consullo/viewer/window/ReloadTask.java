package com.consullo.viewer.window;

import com.consullo.viewer.codec.CodecException;
import com.consullo.viewer.store.ChunkStore;
import java.util.Collections;
import java.util.List;

/**
 * Background load of the three-chunk window around a target chunk.
 *
 * <p>The task is keyed by its target index. It reads the target first, then its neighbours, and hands the
 * result to {@link WindowManager} which commits it only if the task is still the pending one for the live
 * chunk index. Cancellation is cooperative and checked between reads.
 *
 * @since 1.0
 */
final class ReloadTask implements Runnable {

  private final WindowManager window;
  private final ChunkStore store;
  private final int targetIndex;

  private volatile boolean cancelled;

  ReloadTask(WindowManager window, ChunkStore store, int targetIndex) {
    this.window = window;
    this.store = store;
    this.targetIndex = targetIndex;
  }

  int targetIndex() {
    return targetIndex;
  }

  void cancel() {
    this.cancelled = true;
  }

  @Override
  public void run() {
    if (cancelled) {
      return;
    }
    try {
      final List<String> current = store.readChunk(targetIndex);
      if (cancelled) {
        return;
      }
      final List<String> previous = readNeighbour(targetIndex - 1);
      if (cancelled) {
        return;
      }
      final List<String> next = readNeighbour(targetIndex + 1);
      if (cancelled) {
        return;
      }
      window.commit(this, previous, current, next);
    } catch (CodecException | RuntimeException e) {
      window.reloadFailed(this, e);
    }
  }

  private List<String> readNeighbour(int index) throws CodecException {
    if (index < 0 || index >= store.chunkCount()) {
      return Collections.emptyList();
    }
    return store.readChunk(index);
  }

  @Override
  public String toString() {
    return "ReloadTask[target=" + targetIndex + ", cancelled=" + cancelled + "]";
  }
}
