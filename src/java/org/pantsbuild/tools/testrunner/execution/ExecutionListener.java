// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.List;

import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * Receives test progress events. Events for different tests may arrive from different worker
 * threads; the {@link Dispatcher} serializes delivery through a {@link ForwardingListener}.
 */
public abstract class ExecutionListener {

  public void runStarted(List<TestNode> roots) {
  }

  public void testStarted(TestNode test) {
  }

  public void testFinished(TestResult result) {
  }

  public void testOutput(TestOutput output) {
  }

  public void runFinished(List<TestResult> results) {
  }
}
