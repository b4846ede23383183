package com.consullo.viewer.core;

/**
 * Editing mode of the hosting viewer.
 *
 * @since 1.0
 */
public enum EditMode {
  /** Full editing. */
  WRITE,
  /** Scrolling only, no edits. */
  NAVIGATE
}
