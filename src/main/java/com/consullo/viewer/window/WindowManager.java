package com.consullo.viewer.window;

import com.consullo.viewer.core.events.RepaintEvent;
import com.consullo.viewer.core.events.RepaintListener;
import com.consullo.viewer.store.ChunkStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps at most three adjacent chunks decompressed (previous, current, next) and resolves viewport ranges
 * against them.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>{@link #resolve(int, int)} never blocks on decompression. A viewport whose first line lies in a chunk
 * other than the current one switches the current index, schedules a {@link ReloadTask} and answers with
 * placeholders.</li>
 * <li>A reload replaces all three buffers at once, and only if it is still the pending task for the live
 * chunk index. Superseded reloads are cancelled and their late results dropped.</li>
 * <li>Lines outside the document or outside the resident buffers resolve to empty strings.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class WindowManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WindowManager.class);

  private final Object lock = new Object();

  private final ChunkStore store;
  private final Executor executor;
  private final RepaintListener listener;
  private final String placeholder;
  private final int chunkSize;

  // Requested chunk index; -1 until the first resolve.
  private int currentChunkIndex = -1;
  // Chunk index the resident buffers were loaded for.
  private int loadedChunkIndex = -1;

  private List<String> previous = Collections.emptyList();
  private List<String> current = Collections.emptyList();
  private List<String> next = Collections.emptyList();

  private ReloadTask pendingReload;
  private boolean closed;

  /**
   * Creates a window over the given store.
   *
   * @param store chunk store to read from
   * @param executor executor running reload tasks
   * @param listener notified after each committed reload
   * @param placeholder display string returned while a reload is in flight
   */
  public WindowManager(ChunkStore store, Executor executor, RepaintListener listener, String placeholder) {
    Validate.notNull(store, "store must not be null");
    Validate.notNull(executor, "executor must not be null");
    Validate.notNull(listener, "listener must not be null");
    Validate.notNull(placeholder, "placeholder must not be null");
    this.store = store;
    this.executor = executor;
    this.listener = listener;
    this.placeholder = placeholder;
    this.chunkSize = store.chunkSize();
  }

  /**
   * Resolves a viewport range into display strings.
   *
   * <p>Positions before the first line or after the last one resolve to empty strings.
   *
   * @param viewportStart absolute index of the first visible line
   * @param viewportSize number of visible lines
   * @return exactly {@code viewportSize} display strings
   */
  public List<String> resolve(int viewportStart, int viewportSize) {
    Validate.isTrue(viewportSize >= 0, "viewportSize must be non-negative");

    final int requested = Math.max(0, viewportStart) / chunkSize;
    final ReloadTask scheduled;

    synchronized (lock) {
      if (closed) {
        return Collections.nCopies(viewportSize, "");
      }

      if (requested != currentChunkIndex || (loadedChunkIndex != requested && pendingReload == null)) {
        LOGGER.debug("resolve: miss, chunk {} -> {}", currentChunkIndex, requested);
        currentChunkIndex = requested;
        scheduled = replacePendingReload(requested);
      } else if (loadedChunkIndex != requested) {
        // Reload for this index already in flight.
        return Collections.nCopies(viewportSize, placeholder);
      } else {
        return collectLines(viewportStart, viewportSize);
      }
    }

    submit(scheduled);
    return Collections.nCopies(viewportSize, placeholder);
  }

  /**
   * Returns a copy of the resident buffer holding the given chunk, if that chunk is in the window.
   *
   * @param chunkIndex chunk index
   * @return resident lines of the chunk
   */
  public Optional<List<String>> residentLines(int chunkIndex) {
    synchronized (lock) {
      final List<String> slot = slotFor(chunkIndex);
      return slot == null ? Optional.empty() : Optional.of(new ArrayList<>(slot));
    }
  }

  /**
   * Refreshes resident buffers after chunks were written by ingestion.
   *
   * <p>A pending reload whose window overlaps a written chunk may have read the old content; it is replaced
   * by a fresh reload for the same target.
   *
   * @param written chunk index to new chunk content
   */
  public void chunksWritten(Map<Integer, List<String>> written) {
    Validate.notNull(written, "written must not be null");
    ReloadTask scheduled = null;

    synchronized (lock) {
      if (closed) {
        return;
      }
      for (Map.Entry<Integer, List<String>> entry : written.entrySet()) {
        final int index = entry.getKey();
        final List<String> lines = List.copyOf(entry.getValue());
        if (loadedChunkIndex >= 0) {
          if (index == loadedChunkIndex) {
            current = lines;
          } else if (index == loadedChunkIndex - 1) {
            previous = lines;
          } else if (index == loadedChunkIndex + 1) {
            next = lines;
          }
        }
        if (scheduled == null && pendingReload != null && Math.abs(index - pendingReload.targetIndex()) <= 1) {
          LOGGER.debug("chunksWritten: chunk {} overlaps {}, restarting", index, pendingReload);
          scheduled = replacePendingReload(pendingReload.targetIndex());
        }
      }
    }

    if (scheduled != null) {
      submit(scheduled);
    }
  }

  /**
   * Returns the chunk index the window was last asked for.
   *
   * @return requested chunk index, or -1 before the first resolve
   */
  public int currentChunkIndex() {
    synchronized (lock) {
      return currentChunkIndex;
    }
  }

  /**
   * Returns the indexes of the chunks whose buffers are resident and non-empty, in ascending order.
   *
   * @return resident chunk indexes
   */
  public List<Integer> residentChunkIndexes() {
    synchronized (lock) {
      final List<Integer> out = new ArrayList<>(3);
      if (loadedChunkIndex < 0) {
        return out;
      }
      if (!previous.isEmpty()) {
        out.add(loadedChunkIndex - 1);
      }
      if (!current.isEmpty()) {
        out.add(loadedChunkIndex);
      }
      if (!next.isEmpty()) {
        out.add(loadedChunkIndex + 1);
      }
      return out;
    }
  }

  /**
   * Cancels any pending reload and drops all buffers.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (pendingReload != null) {
        pendingReload.cancel();
        pendingReload = null;
      }
      closed = true;
      currentChunkIndex = -1;
      loadedChunkIndex = -1;
      previous = Collections.emptyList();
      current = Collections.emptyList();
      next = Collections.emptyList();
    }
  }

  void commit(ReloadTask task, List<String> previousLines, List<String> currentLines, List<String> nextLines) {
    synchronized (lock) {
      if (closed || task != pendingReload || task.targetIndex() != currentChunkIndex) {
        LOGGER.debug("commit: dropping stale {} (current chunk {})", task, currentChunkIndex);
        return;
      }
      previous = List.copyOf(previousLines);
      current = List.copyOf(currentLines);
      next = List.copyOf(nextLines);
      loadedChunkIndex = task.targetIndex();
      pendingReload = null;
    }

    LOGGER.debug("commit: window loaded around chunk {}", task.targetIndex());
    listener.onRepaint(RepaintEvent.windowLoaded(task.targetIndex()));
  }

  void reloadFailed(ReloadTask task, Exception cause) {
    synchronized (lock) {
      if (task == pendingReload) {
        pendingReload = null;
        if (currentChunkIndex == task.targetIndex()) {
          // Next resolve retries.
          currentChunkIndex = -1;
        }
      }
    }
    LOGGER.error("Failed loading window around chunk {}", task.targetIndex(), cause);
  }

  private ReloadTask replacePendingReload(int target) {
    if (pendingReload != null) {
      pendingReload.cancel();
    }
    pendingReload = new ReloadTask(this, store, target);
    return pendingReload;
  }

  private void submit(ReloadTask task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Reload of chunk {} rejected by executor", task.targetIndex(), e);
      synchronized (lock) {
        if (task == pendingReload) {
          pendingReload = null;
          currentChunkIndex = -1;
        }
      }
    }
  }

  private List<String> slotFor(int chunkIndex) {
    if (loadedChunkIndex < 0) {
      return null;
    }
    if (chunkIndex == loadedChunkIndex) {
      return current;
    }
    if (chunkIndex == loadedChunkIndex - 1) {
      return previous;
    }
    if (chunkIndex == loadedChunkIndex + 1) {
      return next;
    }
    return null;
  }

  private List<String> collectLines(int viewportStart, int viewportSize) {
    final int totalLines = store.totalLines();
    final List<String> result = new ArrayList<>(viewportSize);
    for (int k = 0; k < viewportSize; k++) {
      final long position = (long) viewportStart + k;
      if (position < 0 || position >= totalLines) {
        result.add("");
        continue;
      }
      final int i = (int) position;
      final List<String> slot = slotFor(i / chunkSize);
      final int offset = i % chunkSize;
      result.add(slot != null && offset < slot.size() ? slot.get(offset) : "");
    }
    return Collections.unmodifiableList(result);
  }
}
