// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * An execution listener that forwards all events to a sequence of registered listeners, one
 * event at a time.
 */
public class ForwardingListener extends ExecutionListener {
  /**
   * Fires an event to a listener.
   */
  private interface Event {
    void fire(ExecutionListener listener);
  }

  private final List<ExecutionListener> listeners = Lists.newArrayList();

  public synchronized void addListener(ExecutionListener listener) {
    listeners.add(Preconditions.checkNotNull(listener));
  }

  private synchronized void fire(Event event) {
    for (ExecutionListener listener : listeners) {
      event.fire(listener);
    }
  }

  @Override
  public void runStarted(final List<TestNode> roots) {
    fire(new Event() {
      @Override public void fire(ExecutionListener listener) {
        listener.runStarted(roots);
      }
    });
  }

  @Override
  public void testStarted(final TestNode test) {
    fire(new Event() {
      @Override public void fire(ExecutionListener listener) {
        listener.testStarted(test);
      }
    });
  }

  @Override
  public void testFinished(final TestResult result) {
    fire(new Event() {
      @Override public void fire(ExecutionListener listener) {
        listener.testFinished(result);
      }
    });
  }

  @Override
  public void testOutput(final TestOutput output) {
    fire(new Event() {
      @Override public void fire(ExecutionListener listener) {
        listener.testOutput(output);
      }
    });
  }

  @Override
  public void runFinished(final List<TestResult> results) {
    fire(new Event() {
      @Override public void fire(ExecutionListener listener) {
        listener.runFinished(results);
      }
    });
  }
}
