// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.List;

/**
 * How a composite {@link WorkItem} hands its children off for scheduling and waits for them.
 */
public interface WorkItemDispatcher {

  /**
   * Schedules the children of {@code parent}. Children are started in list order when they share
   * a queue.
   */
  void dispatch(WorkItem parent, List<WorkItem> children);

  /**
   * Blocks until every child is complete, or until {@code parent} itself has been completed by a
   * forced cancel.
   *
   * @throws InterruptedException If the waiting thread is interrupted.
   */
  void awaitChildren(WorkItem parent, List<WorkItem> children) throws InterruptedException;

  /**
   * Where the items report progress.
   */
  ExecutionListener getListener();
}
