// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

/**
 * The lifecycle of a {@link WorkItemQueue}.
 */
public enum WorkItemQueueState {
  /** Accepting and handing out work. */
  OPEN,
  /** Accepting work; dequeuers block until the queue is resumed or stopped. */
  PAUSED,
  /** Terminal. Dequeuers get {@code null} at once. */
  STOPPED
}
