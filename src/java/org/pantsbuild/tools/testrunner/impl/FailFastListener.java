// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import org.pantsbuild.tools.testrunner.execution.Dispatcher;
import org.pantsbuild.tools.testrunner.execution.ExecutionListener;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * A listener that gracefully cancels a run on its first failing test case. Tests already running
 * finish normally; everything else is reported as cancelled.
 */
class FailFastListener extends ExecutionListener {
  private static final Logger logger = Logger.getLogger(FailFastListener.class.getName());

  private final Dispatcher dispatcher;
  private final AtomicBoolean aborted = new AtomicBoolean(false);

  FailFastListener(Dispatcher dispatcher) {
    this.dispatcher = Preconditions.checkNotNull(dispatcher);
  }

  @Override
  public void testFinished(TestResult result) {
    if (result.getTest().isLeaf()
        && result.getState().isFailure()
        && aborted.compareAndSet(false, true)) {
      logger.info("Failing fast after " + result.getTest().getName());
      // A graceful cancel never completes items itself, so it fires no events back into the
      // listener chain we are being called from.
      dispatcher.cancel(false);
    }
  }
}
