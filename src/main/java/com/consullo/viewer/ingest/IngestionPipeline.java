package com.consullo.viewer.ingest;

import com.consullo.viewer.codec.CodecException;
import com.consullo.viewer.store.ChunkStore;
import com.consullo.viewer.store.StagedChunk;
import com.consullo.viewer.window.WindowManager;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends lines at the logical end of a chunked document.
 *
 * <p>
 * Each call:
 * <ul>
 * <li>takes the tail chunk's content from the window when it is resident, otherwise decompresses it;</li>
 * <li>fills the tail up to the chunk capacity and opens new chunks for the remainder;</li>
 * <li>compresses every touched chunk before committing any of them, so a codec failure leaves the store and
 * its line count untouched;</li>
 * <li>refreshes the window's resident buffers after the commit.</li>
 * </ul>
 * </p>
 *
 * <p>Only one append may be in flight at a time.
 *
 * @since 1.0
 */
public final class IngestionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionPipeline.class);

  private final ChunkStore store;
  private final WindowManager window;
  private final int chunkSize;

  private final AtomicBoolean inFlight = new AtomicBoolean();

  public IngestionPipeline(ChunkStore store, WindowManager window) {
    Validate.notNull(store, "store must not be null");
    Validate.notNull(window, "window must not be null");
    this.store = store;
    this.window = window;
    this.chunkSize = store.chunkSize();
  }

  /**
   * Appends lines to the end of the document.
   *
   * @param newLines lines to append (no element may contain {@code '\n'})
   * @throws CodecException if a chunk cannot be compressed or the tail cannot be decompressed; nothing is
   *     committed in that case
   * @throws IllegalStateException if another append is in flight
   */
  public void append(List<String> newLines) throws CodecException {
    Validate.notNull(newLines, "newLines must not be null");
    if (newLines.isEmpty()) {
      return;
    }
    if (!inFlight.compareAndSet(false, true)) {
      throw new IllegalStateException("Another append is already in flight");
    }

    try {
      final int total = store.totalLines();
      final List<StagedChunk> staged = new ArrayList<>();
      final Map<Integer, List<String>> written = new LinkedHashMap<>();

      int placed = 0;
      while (placed < newLines.size()) {
        final int position = total + placed;
        final int index = position / chunkSize;
        final List<String> chunkLines = new ArrayList<>(chunkSize);
        if (placed == 0) {
          chunkLines.addAll(tailContent(index, position - index * chunkSize));
        }

        final int take = Math.min(chunkSize - chunkLines.size(), newLines.size() - placed);
        chunkLines.addAll(newLines.subList(placed, placed + take));
        placed += take;

        staged.add(store.stage(index, chunkLines));
        written.put(index, chunkLines);
      }

      store.commit(staged, newLines.size());
      window.chunksWritten(written);
      LOGGER.debug("append: +{} lines over {} chunk(s), totalLines={}",
          newLines.size(), staged.size(), store.totalLines());
    } finally {
      inFlight.set(false);
    }
  }

  // Existing lines of the chunk the next line goes into; empty when it starts a new chunk.
  private List<String> tailContent(int index, int expectedSize) throws CodecException {
    if (expectedSize == 0) {
      return List.of();
    }

    final Optional<List<String>> resident = window.residentLines(index);
    if (resident.isPresent() && resident.get().size() == expectedSize) {
      LOGGER.debug("append: tail chunk {} taken from window", index);
      return resident.get();
    }

    final List<String> stored = store.readChunk(index);
    if (stored.size() != expectedSize) {
      throw new IllegalStateException(
          "tail chunk " + index + " holds " + stored.size() + " lines, expected " + expectedSize);
    }
    return stored;
  }
}
