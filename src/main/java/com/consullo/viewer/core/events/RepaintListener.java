package com.consullo.viewer.core.events;

/**
 * Listener for repaint notifications.
 *
 * <p>Invoked on the thread that completed the work, which is usually not the viewer's thread.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface RepaintListener {

  /**
   * Called when the viewer should query its line source again.
   *
   * @param event repaint event
   */
  void onRepaint(RepaintEvent event);
}
