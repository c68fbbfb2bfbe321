// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.PrintStream;
import java.text.NumberFormat;
import java.util.List;

import com.google.common.collect.Lists;

import org.pantsbuild.tools.testrunner.execution.ExecutionListener;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * A listener that logs test events with single characters and summarizes the run when it
 * finishes, in the format of JUnit's text listener.
 */
class ConsoleListener extends ExecutionListener {
  private final PrintStream out;
  private final List<TestResult> problems = Lists.newArrayList();
  private long startNanos;

  ConsoleListener(PrintStream out) {
    this.out = out;
  }

  protected PrintStream getOut() {
    return out;
  }

  @Override
  public void runStarted(List<TestNode> roots) {
    startNanos = System.nanoTime();
  }

  @Override
  public void testFinished(TestResult result) {
    if (isProblem(result)) {
      problems.add(result);
    }
    if (result.getTest().isLeaf()) {
      printProgress(result);
    }
  }

  /**
   * Prints progress for a finished test case.
   */
  protected void printProgress(TestResult result) {
    out.append(progressChar(result.getState()));
  }

  @Override
  public void runFinished(List<TestResult> results) {
    printHeader(System.nanoTime() - startNanos);
    printProblems();
    printFooter(results);
    out.flush();
  }

  // A suite is only reported on its own when it failed in its one-time set-up or tear-down.
  private static boolean isProblem(TestResult result) {
    if (!result.getState().isFailure()) {
      return false;
    }
    return result.getTest().isLeaf() || result.getFailure() != null;
  }

  private static char progressChar(ResultState state) {
    switch (state) {
      case SUCCESS:
        return '.';
      case FAILURE:
        return 'F';
      case ERROR:
        return 'E';
      case SKIPPED:
        return 'I';
      case INCONCLUSIVE:
        return 'A';
      case CANCELLED:
        return 'C';
      default:
        throw new IllegalArgumentException("Unhandled state " + state);
    }
  }

  private void printHeader(long elapsedNanos) {
    out.println();
    out.println("Time: " + NumberFormat.getInstance().format(elapsedNanos / 1.0e9));
  }

  private void printProblems() {
    if (problems.isEmpty()) {
      return;
    }
    if (problems.size() == 1) {
      out.println("There was 1 failure:");
    } else {
      out.println("There were " + problems.size() + " failures:");
    }
    int i = 1;
    for (TestResult problem : problems) {
      out.println(i++ + ") " + problem.getTest().getName());
      String trace = problem.getStackTrace();
      out.print(trace != null ? trace : problem.getMessage() + "\n");
    }
  }

  private void printFooter(List<TestResult> results) {
    int run = 0;
    int failures = 0;
    int errors = 0;
    int skipped = 0;
    int cancelled = 0;
    for (TestResult result : results) {
      run += result.getTotalCount();
      failures += result.getFailCount();
      errors += result.getErrorCount();
      skipped += result.getSkipCount() + result.getInconclusiveCount();
      cancelled += result.getCancelledCount();
    }
    out.println();
    if (problems.isEmpty() && cancelled == 0) {
      out.println("OK (" + run + " test" + (run == 1 ? "" : "s") + ")");
    } else {
      out.println(problems.isEmpty() ? "CANCELLED" : "FAILURES!!!");
      out.println(String.format(
          "Tests run: %d,  Failures: %d,  Errors: %d,  Skipped: %d,  Cancelled: %d",
          run, failures, errors, skipped, cancelled));
    }
    out.println();
  }
}
