package com.consullo.viewer.store;

import com.consullo.viewer.codec.CodecException;
import com.consullo.viewer.codec.LineCodec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered sequence of compressed fixed-capacity chunks plus the authoritative line counter.
 *
 * <p>Chunk {@code k} holds lines {@code [k * chunkSize, (k + 1) * chunkSize)}; only the last chunk may be
 * partially filled. Chunks are appended at the tail and rewritten in place only when lines are merged into
 * the tail chunk.
 *
 * <p>Writes go through {@link #stage(int, List)} and {@link #commit(List, int)} so that a multi-chunk append
 * either lands completely or not at all. Callers must serialize writers; reads may run concurrently.
 *
 * @since 1.0
 */
public final class ChunkStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkStore.class);

  private final Object lock = new Object();

  private final LineCodec codec;
  private final int chunkSize;

  private final List<byte[]> chunks = new ArrayList<>();
  private int totalLines;
  private long compressedSize;

  /**
   * Creates an empty store.
   *
   * @param codec codec used for chunk content
   * @param chunkSize maximum number of lines per chunk
   */
  public ChunkStore(final LineCodec codec, final int chunkSize) {
    Validate.notNull(codec, "codec must not be null");
    Validate.isTrue(chunkSize > 0, "chunkSize must be positive");
    this.codec = codec;
    this.chunkSize = chunkSize;
  }

  public int chunkSize() {
    return chunkSize;
  }

  public int totalLines() {
    synchronized (lock) {
      return totalLines;
    }
  }

  public int chunkCount() {
    synchronized (lock) {
      return chunks.size();
    }
  }

  /**
   * Returns the sum of all stored chunk byte lengths.
   *
   * @return compressed size in bytes
   */
  public long compressedSize() {
    synchronized (lock) {
      return compressedSize;
    }
  }

  /**
   * Reads and decompresses a chunk.
   *
   * <p>Out-of-bounds indices behave as an empty chunk, since the window probes neighbours that may not exist.
   *
   * @param index chunk index
   * @return lines of the chunk, or an empty list
   * @throws CodecException if the stored chunk cannot be decompressed
   */
  public List<String> readChunk(final int index) throws CodecException {
    final byte[] data;
    synchronized (lock) {
      if (index < 0 || index >= chunks.size()) {
        return Collections.emptyList();
      }
      data = chunks.get(index);
    }
    return codec.decompress(data);
  }

  /**
   * Compresses and stores a single chunk.
   *
   * <p>{@code index == chunkCount()} appends, {@code index < chunkCount()} overwrites. Does not change
   * {@link #totalLines()}.
   *
   * @param index chunk index
   * @param lines chunk content
   * @throws CodecException if compression fails
   */
  public void writeChunk(final int index, final List<String> lines) throws CodecException {
    commit(List.of(stage(index, lines)), 0);
  }

  /**
   * Compresses chunk content without modifying the store.
   *
   * @param index target chunk index
   * @param lines chunk content (at most {@code chunkSize} lines)
   * @return staged chunk ready for {@link #commit(List, int)}
   * @throws CodecException if compression fails
   */
  public StagedChunk stage(final int index, final List<String> lines) throws CodecException {
    Validate.isTrue(index >= 0, "index must be non-negative");
    Validate.notNull(lines, "lines must not be null");
    Validate.isTrue(lines.size() <= chunkSize, "chunk holds %d lines, capacity is %d", lines.size(), chunkSize);
    return new StagedChunk(index, lines.size(), codec.compress(lines));
  }

  /**
   * Applies staged chunks in order and advances the line counter, as one step.
   *
   * <p>Every staged index must be at most the chunk count at the moment it is applied; the whole batch is
   * validated before anything is written.
   *
   * @param staged staged chunks, in ascending index order
   * @param linesAdded number of newly ingested lines the batch represents
   */
  public void commit(final List<StagedChunk> staged, final int linesAdded) {
    Validate.notNull(staged, "staged must not be null");
    Validate.isTrue(linesAdded >= 0, "linesAdded must be non-negative");

    synchronized (lock) {
      int count = chunks.size();
      for (StagedChunk chunk : staged) {
        if (chunk.index() > count) {
          throw new IllegalArgumentException(
              "chunk index " + chunk.index() + " is beyond the tail (chunkCount=" + count + ")");
        }
        if (chunk.index() == count) {
          count++;
        }
      }

      for (StagedChunk chunk : staged) {
        if (chunk.index() < chunks.size()) {
          compressedSize -= chunks.get(chunk.index()).length;
          chunks.set(chunk.index(), chunk.data());
        } else {
          chunks.add(chunk.data());
        }
        compressedSize += chunk.data().length;
      }
      totalLines += linesAdded;

      LOGGER.debug("commit: {} chunk(s), +{} lines, totalLines={}, chunkCount={}, compressedSize={}",
          staged.size(), linesAdded, totalLines, chunks.size(), compressedSize);
    }
  }
}
