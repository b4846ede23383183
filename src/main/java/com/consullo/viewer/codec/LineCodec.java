package com.consullo.viewer.codec;

import java.util.List;

/**
 * Stateless compression contract for a sequence of lines.
 *
 * <p>Implementations join lines with a single {@code '\n'} separator, so lines must not contain an embedded
 * newline. For every list {@code L} satisfying that precondition, {@code decompress(compress(L))} equals
 * {@code L}.
 *
 * @since 1.0
 */
public interface LineCodec {

  /**
   * Compresses the provided lines into an opaque byte buffer.
   *
   * @param lines lines to compress (no element may contain {@code '\n'})
   * @return fully drained compressed buffer
   * @throws CodecException if compression fails
   */
  byte[] compress(final List<String> lines) throws CodecException;

  /**
   * Decompresses a buffer previously produced by {@link #compress(List)}.
   *
   * @param data compressed buffer
   * @return decoded lines, in order
   * @throws CodecException if the buffer is corrupt or cannot be decoded
   */
  List<String> decompress(final byte[] data) throws CodecException;
}
