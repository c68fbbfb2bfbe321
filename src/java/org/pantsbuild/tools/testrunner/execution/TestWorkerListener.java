// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import javax.annotation.Nullable;

/**
 * Lifecycle callbacks from a {@link TestWorker}, all made synchronously on the worker's thread.
 * An exception thrown from any of them kills the worker.
 */
public interface TestWorkerListener {

  /**
   * Called after {@code item} is assigned to {@code worker} and before it executes. Anything the
   * item enqueues while executing is routed according to the state left by this call.
   */
  void busy(TestWorker worker, WorkItem item);

  /**
   * Called after {@code item} has finished executing, unless a forced cancel abandoned it.
   */
  void idle(TestWorker worker, WorkItem item);

  /**
   * Offered each item the worker takes from its queue while it helps, that is while an item it is
   * executing waits for its children. Returning {@code true} means the listener has sent the item
   * to run on another worker; the helping worker then waits for it instead of executing it.
   */
  boolean handOff(TestWorker worker, WorkItem item);

  /**
   * Called as the worker's thread exits.
   *
   * @param cause What killed the worker, or {@code null} if it stopped normally.
   */
  void stopped(TestWorker worker, @Nullable Throwable cause);
}
