package com.consullo.viewer.session;

/**
 * Thrown when a chunked-mode operation is invoked while chunked mode is not active.
 *
 * @since 1.0
 */
public class NotActivatedException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NotActivatedException(final String message) {
    super(message);
  }
}
