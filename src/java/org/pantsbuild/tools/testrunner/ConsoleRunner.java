// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner;

import org.pantsbuild.tools.testrunner.impl.ConsoleRunnerImpl;

/**
 * Main entry point for the parallel test runner.
 *
 * All implementation classes live in sub-packages so they can be shaded.
 */
public class ConsoleRunner {
  public static void main(String args[]) {
    ConsoleRunnerImpl.main(args);
  }
}
