// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.PrintStream;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.pantsbuild.tools.testrunner.execution.ExecutionListener;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * A listener that keeps track of the tests currently running so it can report them if the VM
 * exits unexpectedly in the middle of a run.
 */
class ShutdownListener extends ExecutionListener {
  // Leaves are added on testStarted and removed on testFinished.
  private final Set<TestNode> running = ConcurrentHashMap.newKeySet();
  private final PrintStream out;

  ShutdownListener(PrintStream out) {
    this.out = out;
  }

  /**
   * Reports every test case still running as crashed.
   */
  void unexpectedShutdown() {
    for (TestNode test : running) {
      out.println(test.getName() + " -> FAILED: Abnormal VM exit - test crashed."
          + " The test run may have timed out.");
    }
    out.flush();
  }

  @Override
  public void testStarted(TestNode test) {
    if (test.isLeaf()) {
      running.add(test);
    }
  }

  @Override
  public void testFinished(TestResult result) {
    running.remove(result.getTest());
  }
}
