package com.consullo.viewer.codec;

import java.io.IOException;

/**
 * Signals that a chunk could not be compressed or decompressed.
 *
 * @since 1.0
 */
public class CodecException extends IOException {

  private static final long serialVersionUID = 1L;

  public CodecException(final String message) {
    super(message);
  }

  public CodecException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
