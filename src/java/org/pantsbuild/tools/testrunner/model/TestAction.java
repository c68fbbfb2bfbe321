// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

/**
 * The executable body of a test case, or a suite's one-time set-up or tear-down.
 * <P>
 * Throwing an {@link AssertionError} records a failure, throwing a JUnit
 * {@code AssumptionViolatedException} records an inconclusive result, and any other throwable
 * records an error.
 * </P>
 */
public interface TestAction {
  void run(TestContext context) throws Throwable;
}
