package com.consullo.viewer.session;

import org.apache.commons.lang3.Validate;

/**
 * Chunked-mode configuration values.
 *
 * @param chunkSize number of lines per compressed chunk; must exceed the viewport size
 * @param loadingPlaceholder display string shown for lines whose chunk is still being decompressed
 * @since 1.0
 */
public record ChunkLoaderConfig(
    int chunkSize,
    String loadingPlaceholder) {

  public static final int DEFAULT_CHUNK_SIZE = 50_000;
  public static final String DEFAULT_LOADING_PLACEHOLDER = "...";

  public ChunkLoaderConfig {
    Validate.isTrue(chunkSize > 0, "chunkSize must be positive");
    Validate.notNull(loadingPlaceholder, "loadingPlaceholder must not be null");
  }

  /**
   * Creates a configuration with the default placeholder.
   *
   * @param chunkSize lines per chunk
   * @return configuration
   */
  public static ChunkLoaderConfig ofChunkSize(int chunkSize) {
    return new ChunkLoaderConfig(chunkSize, DEFAULT_LOADING_PLACEHOLDER);
  }
}
