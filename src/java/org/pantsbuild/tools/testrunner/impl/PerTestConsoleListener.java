// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.PrintStream;

import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * A console listener that shows each test class as it starts and each test with its timing as it
 * finishes.
 */
class PerTestConsoleListener extends ConsoleListener {

  PerTestConsoleListener(PrintStream out) {
    super(out);
  }

  @Override
  public void testStarted(TestNode test) {
    if (test.isComposite()) {
      getOut().println(test.getName());
    }
  }

  @Override
  protected void printProgress(TestResult result) {
    StringBuilder line = new StringBuilder("\t")
        .append(result.getTest().getName())
        .append(" (").append(result.getDuration().toMillis()).append(" ms)");
    switch (result.getState()) {
      case FAILURE:
      case ERROR:
        line.append(" -> FAILED");
        break;
      case SKIPPED:
        line.append(" -> IGNORED");
        break;
      case CANCELLED:
        line.append(" -> CANCELLED");
        break;
      default:
        break;
    }
    getOut().println(line);
  }
}
