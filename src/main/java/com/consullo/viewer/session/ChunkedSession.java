package com.consullo.viewer.session;

import com.consullo.viewer.codec.LineCodec;
import com.consullo.viewer.core.events.RepaintListener;
import com.consullo.viewer.ingest.IngestionPipeline;
import com.consullo.viewer.store.ChunkStore;
import com.consullo.viewer.window.WindowManager;
import java.util.concurrent.Executor;
import org.apache.commons.lang3.Validate;

/**
 * State of one chunked-mode session.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>chunk store (compressed chunks + line counter)</li>
 * <li>window manager (decompressed previous/current/next buffers)</li>
 * <li>ingestion pipeline (append at the end)</li>
 * </ul>
 * </p>
 *
 * <p>A session is created on activation and closed on deactivation or clear; it is never reused.
 */
public final class ChunkedSession implements AutoCloseable {

  private final ChunkLoaderConfig config;
  private final ChunkStore store;
  private final WindowManager window;
  private final IngestionPipeline ingestion;

  private ChunkedSession(ChunkLoaderConfig config, ChunkStore store, WindowManager window) {
    this.config = config;
    this.store = store;
    this.window = window;
    this.ingestion = new IngestionPipeline(store, window);
  }

  /**
   * Creates an empty session.
   *
   * @param config chunk configuration
   * @param codec codec for chunk content
   * @param executor executor running window reloads
   * @param repaintListener notified when a window reload lands
   * @return new session
   */
  public static ChunkedSession create(
      ChunkLoaderConfig config, LineCodec codec, Executor executor, RepaintListener repaintListener) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(codec, "codec must not be null");

    ChunkStore store = new ChunkStore(codec, config.chunkSize());
    WindowManager window = new WindowManager(store, executor, repaintListener, config.loadingPlaceholder());
    return new ChunkedSession(config, store, window);
  }

  public ChunkLoaderConfig config() {
    return config;
  }

  public ChunkStore store() {
    return store;
  }

  public WindowManager window() {
    return window;
  }

  public IngestionPipeline ingestion() {
    return ingestion;
  }

  /**
   * Returns an immutable snapshot of the session counters.
   *
   * @return statistics snapshot
   */
  public SessionStats stats() {
    return SessionStats.builder()
        .chunkSize(config.chunkSize())
        .totalLines(store.totalLines())
        .chunkCount(store.chunkCount())
        .compressedSize(store.compressedSize())
        .residentChunks(window.residentChunkIndexes())
        .build();
  }

  @Override
  public void close() {
    window.close();
  }
}
