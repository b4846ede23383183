package com.consullo.viewer.store;

/**
 * A chunk that has been compressed but not yet committed to a {@link ChunkStore}.
 *
 * @param index target chunk index
 * @param lineCount number of lines encoded in {@code data}
 * @param data compressed chunk content
 * @since 1.0
 */
public record StagedChunk(int index, int lineCount, byte[] data) {
}
