package com.consullo.viewer.window;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Executor that queues tasks until the test runs them, so reload ordering is deterministic.
 */
public final class ManualExecutor implements Executor {

  private final Deque<Runnable> queue = new ArrayDeque<>();

  @Override
  public void execute(Runnable command) {
    queue.addLast(command);
  }

  public int pending() {
    return queue.size();
  }

  /**
   * Runs queued tasks, including tasks queued while running, in submission order.
   */
  public void runAll() {
    while (!queue.isEmpty()) {
      queue.pollFirst().run();
    }
  }

  /**
   * Runs queued tasks in reverse submission order. Tasks queued while running are not run.
   */
  public void runAllReversed() {
    final List<Runnable> tasks = new ArrayList<>(queue);
    queue.clear();
    for (int i = tasks.size() - 1; i >= 0; i--) {
      tasks.get(i).run();
    }
  }
}
