// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * Thrown by {@link Dispatcher#run} when the scheduler failed and the run was stopped early. The
 * partial results are kept; every test that had not finished is reported as cancelled.
 */
public class RunAbortedException extends RuntimeException {
  private final ImmutableList<TestResult> partialResults;

  public RunAbortedException(String message, Throwable cause, List<TestResult> partialResults) {
    super(message, cause);
    this.partialResults = ImmutableList.copyOf(partialResults);
  }

  public ImmutableList<TestResult> getPartialResults() {
    return partialResults;
  }
}
