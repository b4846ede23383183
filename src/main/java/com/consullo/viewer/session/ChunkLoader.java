package com.consullo.viewer.session;

import com.consullo.viewer.codec.CodecException;
import com.consullo.viewer.codec.GzipLineCodec;
import com.consullo.viewer.codec.LineCodec;
import com.consullo.viewer.core.EditMode;
import com.consullo.viewer.core.HostViewer;
import com.consullo.viewer.core.LineSource;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches a {@link HostViewer} between its normal line source and chunked storage for very large documents.
 *
 * <p>While active, the viewer is in {@link EditMode#NAVIGATE} and renders from a {@link ChunkedLineSource}.
 * Lines are added with {@link #appendLines(List)}; decompression and compression run on a single executor so
 * the viewer's thread never waits on the codec.
 *
 * <p>Typical use:
 * <pre>{@code
 * ChunkLoader loader = new ChunkLoader(viewer);
 * loader.activate();
 * loader.appendLines(largeListOfLines).join();
 * }</pre>
 *
 * @since 1.0
 */
public final class ChunkLoader implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkLoader.class);

  private final Object lock = new Object();

  private final HostViewer viewer;
  private final LineCodec codec;
  private final Executor executor;
  private final boolean ownsExecutor;

  private volatile ChunkedSession session;
  private LineSource normalLineSource;

  /**
   * Creates a loader with a gzip codec and a private single-thread executor.
   *
   * @param viewer hosting viewer
   */
  public ChunkLoader(final HostViewer viewer) {
    this(viewer, new GzipLineCodec(), Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "ChunkLoader");
      t.setDaemon(true);
      return t;
    }), true);
  }

  /**
   * Creates a loader with the given codec and executor. The executor is not shut down by {@link #close()}.
   *
   * @param viewer hosting viewer
   * @param codec chunk codec
   * @param executor executor running codec work
   */
  public ChunkLoader(final HostViewer viewer, final LineCodec codec, final Executor executor) {
    this(viewer, codec, executor, false);
  }

  ChunkLoader(HostViewer viewer, LineCodec codec, Executor executor, boolean ownsExecutor) {
    Validate.notNull(viewer, "viewer must not be null");
    Validate.notNull(codec, "codec must not be null");
    Validate.notNull(executor, "executor must not be null");
    this.viewer = viewer;
    this.codec = codec;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
  }

  /**
   * Activates chunked mode with the default chunk size of 50 000 lines.
   *
   * @throws InvalidConfigurationException if the viewport is not smaller than the chunk size
   */
  public void activate() {
    activate(ChunkLoaderConfig.DEFAULT_CHUNK_SIZE);
  }

  /**
   * Activates chunked mode.
   *
   * @param chunkSize lines per chunk
   * @throws InvalidConfigurationException if {@code chunkSize} is not positive or the viewport is not smaller
   *     than it
   */
  public void activate(final int chunkSize) {
    if (chunkSize <= 0) {
      throw new InvalidConfigurationException("chunkSize must be positive, got " + chunkSize);
    }
    activate(ChunkLoaderConfig.ofChunkSize(chunkSize));
  }

  /**
   * Activates chunked mode, discarding any chunked content from a previous activation.
   *
   * @param config chunk configuration
   * @throws InvalidConfigurationException if the viewport is not smaller than the chunk size
   */
  public void activate(final ChunkLoaderConfig config) {
    Validate.notNull(config, "config must not be null");
    final int viewportSize = viewer.viewportSize();
    if (viewportSize >= config.chunkSize()) {
      throw new InvalidConfigurationException(
          "Viewport " + viewportSize + " can't be larger than chunkSize " + config.chunkSize());
    }

    final ChunkedSession fresh;
    synchronized (lock) {
      if (session == null) {
        normalLineSource = viewer.lineSource();
      } else {
        session.close();
      }
      fresh = newSession(config);
      session = fresh;
    }

    viewer.editMode(EditMode.NAVIGATE);
    viewer.lineSource(new ChunkedLineSource(fresh));
    viewer.render(true);
    LOGGER.info("Chunked mode activated, chunkSize={}", config.chunkSize());
  }

  /**
   * Restores the normal line source and write mode, discarding all chunked content.
   */
  public void deactivate() {
    final LineSource restore;
    synchronized (lock) {
      if (session != null) {
        session.close();
        session = null;
      }
      restore = normalLineSource;
      normalLineSource = null;
    }

    if (restore != null) {
      viewer.lineSource(restore);
    }
    viewer.editMode(EditMode.WRITE);
    viewer.render(true);
    LOGGER.info("Chunked mode deactivated");
  }

  /**
   * Discards all chunked content while staying in chunked mode.
   */
  public void clear() {
    ChunkedSession fresh = null;
    synchronized (lock) {
      if (session != null) {
        final ChunkLoaderConfig config = session.config();
        session.close();
        fresh = newSession(config);
        session = fresh;
      }
    }

    if (fresh != null) {
      viewer.lineSource(new ChunkedLineSource(fresh));
    }
    viewer.render(true);
    LOGGER.debug("Chunked content cleared");
  }

  /**
   * Appends lines to the chunked document and repaints when done.
   *
   * @param lines lines to append
   * @return future completing once the lines are stored
   * @throws NotActivatedException if chunked mode is not active
   */
  public CompletableFuture<Void> appendLines(final List<String> lines) {
    return appendLines(lines, false);
  }

  /**
   * Appends lines to the chunked document.
   *
   * <p>The future completes exceptionally with a {@link CodecException} if a chunk cannot be compressed, in
   * which case none of the lines were stored. Callers must wait for one append to finish before starting the
   * next.
   *
   * @param lines lines to append (no element may contain {@code '\n'})
   * @param skipRender true to skip the repaint after the append
   * @return future completing once the lines are stored
   * @throws NotActivatedException if chunked mode is not active
   */
  public CompletableFuture<Void> appendLines(final List<String> lines, final boolean skipRender) {
    final ChunkedSession target = session;
    if (target == null) {
      throw new NotActivatedException("ChunkLoader is not activated. Call activate() first.");
    }
    Validate.notNull(lines, "lines must not be null");
    final List<String> copy = List.copyOf(lines);

    return CompletableFuture.runAsync(() -> {
      try {
        target.ingestion().append(copy);
      } catch (CodecException e) {
        throw new CompletionException(e);
      }
    }, executor).thenRun(() -> {
      if (!skipRender && target == session) {
        viewer.render(false);
      }
    });
  }

  public boolean isEnabled() {
    return session != null;
  }

  public int totalLines() {
    final ChunkedSession s = session;
    return s == null ? 0 : s.store().totalLines();
  }

  public int chunkCount() {
    final ChunkedSession s = session;
    return s == null ? 0 : s.store().chunkCount();
  }

  /**
   * Returns the total compressed size in bytes.
   *
   * @return compressed size, 0 when inactive
   */
  public long compressedSize() {
    final ChunkedSession s = session;
    return s == null ? 0L : s.store().compressedSize();
  }

  /**
   * Returns a snapshot of the active session's counters.
   *
   * @return session statistics
   * @throws NotActivatedException if chunked mode is not active
   */
  public SessionStats stats() {
    final ChunkedSession s = session;
    if (s == null) {
      throw new NotActivatedException("ChunkLoader is not activated.");
    }
    return s.stats();
  }

  @Override
  public void close() {
    if (isEnabled()) {
      deactivate();
    }
    if (ownsExecutor && executor instanceof ExecutorService) {
      ((ExecutorService) executor).shutdown();
    }
  }

  private ChunkedSession newSession(ChunkLoaderConfig config) {
    return ChunkedSession.create(config, codec, executor, event -> viewer.render(false));
  }
}
