package com.consullo.viewer.session;

/**
 * Thrown when chunked mode cannot be activated with the requested configuration.
 *
 * @since 1.0
 */
public class InvalidConfigurationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidConfigurationException(final String message) {
    super(message);
  }
}
