// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

/**
 * What a running {@link TestAction} can see of its surroundings.
 */
public interface TestContext {

  /**
   * The test being run.
   */
  TestNode getTest();

  /**
   * Returns {@code true} once the run or this test has been asked to stop. Long-running bodies
   * should poll this and return early.
   */
  boolean isCancellationRequested();

  /**
   * The apartment of the thread the body is running on.
   */
  ApartmentState getApartment();

  /**
   * Records a line of output against this test.
   *
   * @param stream The stream name, usually {@link TestOutput#OUT} or {@link TestOutput#ERROR}.
   * @param text The text to record.
   */
  void write(String stream, String text);
}
