package com.consullo.viewer.core;

/**
 * The viewer that hosts a document: owns the viewport, the edit mode and the active {@link LineSource}.
 *
 * <p>Rendering, input handling and selection live behind this interface. The chunk loader only switches
 * the viewer's line source and mode, and asks it to repaint.
 *
 * @since 1.0
 */
public interface HostViewer {

  /**
   * Returns the number of visible rows.
   *
   * @return viewport line count
   */
  int viewportSize();

  EditMode editMode();

  void editMode(EditMode mode);

  /**
   * Returns the line source the viewer currently renders from.
   *
   * @return active line source
   */
  LineSource lineSource();

  /**
   * Installs the line source the viewer renders from.
   *
   * @param source new active line source
   */
  void lineSource(LineSource source);

  /**
   * Requests a repaint. The viewer re-queries {@link LineSource#readLines(int, int)} for its viewport.
   *
   * @param full true to repaint everything, including gutters and line counts
   */
  void render(boolean full);
}
