// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.pantsbuild.tools.testrunner.model.ResultState;

/**
 * Enforces per-test deadlines. When a test case runs past its timeout it is first asked to cancel;
 * if it is still running after the grace period it is aborted as a failure, and a worker still
 * stuck in its body is reported so it can be replaced.
 */
final class TimeoutPolicy {
  private static final Logger logger = Logger.getLogger(TimeoutPolicy.class.getName());

  static final String TIMEOUT_MESSAGE = "Test exceeded timeout value of %d ms";

  /**
   * Hears about workers left executing a test case that has already been aborted.
   */
  interface StuckWorkerHandler {
    void workerStuck(TestWorker worker, WorkItem item);
  }

  private final long gracePeriodMillis;
  private final StuckWorkerHandler stuckWorkerHandler;
  private final ScheduledExecutorService scheduler;

  TimeoutPolicy(long gracePeriodMillis, StuckWorkerHandler stuckWorkerHandler) {
    Preconditions.checkArgument(gracePeriodMillis >= 0);
    this.gracePeriodMillis = gracePeriodMillis;
    this.stuckWorkerHandler = Preconditions.checkNotNull(stuckWorkerHandler);
    this.scheduler = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("test-timeout-%d")
            .build());
  }

  /**
   * Starts the clock on {@code item}, which {@code worker} is about to execute.
   */
  void arm(final WorkItem item, final TestWorker worker, final long timeoutMillis) {
    Preconditions.checkArgument(timeoutMillis > 0, "Timeout must be positive: %s", timeoutMillis);
    final ScheduledFuture<?> deadline;
    try {
      deadline = scheduler.schedule(new Runnable() {
        @Override
        public void run() {
          expire(item, worker, timeoutMillis);
        }
      }, timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      // The run is shutting down.
      logger.fine("Not timing " + item.getName() + ": timeouts are shut down");
      return;
    }
    item.addCompletionListener(new WorkItem.CompletionListener() {
      @Override
      public void workItemCompleted(WorkItem completed) {
        deadline.cancel(false);
      }
    });
  }

  private void expire(final WorkItem item, final TestWorker worker, final long timeoutMillis) {
    if (item.isComplete()) {
      return;
    }
    logger.fine(String.format("%s ran past its %d ms timeout on %s; cancelling",
        item.getName(), timeoutMillis, worker.getName()));
    item.cancel(false);

    final ScheduledFuture<?> abort = scheduler.schedule(new Runnable() {
      @Override
      public void run() {
        if (item.isComplete()) {
          return;
        }
        item.abort(ResultState.FAILURE, String.format(TIMEOUT_MESSAGE, timeoutMillis));
        checkStuck(item, worker);
      }
    }, gracePeriodMillis, TimeUnit.MILLISECONDS);
    item.addCompletionListener(new WorkItem.CompletionListener() {
      @Override
      public void workItemCompleted(WorkItem completed) {
        abort.cancel(false);
      }
    });
  }

  // The abort interrupts the body; give it one more grace period to unwind before calling the
  // worker stuck.
  private void checkStuck(final WorkItem item, final TestWorker worker) {
    try {
      scheduler.schedule(new Runnable() {
        @Override
        public void run() {
          if (worker.getCurrentWorkItem() == item) {
            stuckWorkerHandler.workerStuck(worker, item);
          }
        }
      }, gracePeriodMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.fine("Not checking on " + worker.getName() + ": timeouts are shut down");
    }
  }

  void shutdown() {
    scheduler.shutdownNow();
  }
}
