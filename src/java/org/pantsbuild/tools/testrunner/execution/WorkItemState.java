// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

/**
 * The lifecycle of a {@link WorkItem}.
 */
public enum WorkItemState {
  NOT_STARTED,
  RUNNING,
  /** A graceful cancel arrived while running; the current action finishes, nothing new starts. */
  CANCELLING,
  COMPLETE
}
