// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

import com.google.common.base.Preconditions;

/**
 * A unit of output written by a test to a named stream.
 */
public final class TestOutput {
  public static final String OUT = "Out";
  public static final String ERROR = "Error";

  private final String text;
  private final String stream;
  private final String testId;
  private final String testName;

  public TestOutput(String text, String stream, String testId, String testName) {
    this.text = Preconditions.checkNotNull(text);
    this.stream = Preconditions.checkNotNull(stream);
    this.testId = Preconditions.checkNotNull(testId);
    this.testName = Preconditions.checkNotNull(testName);
  }

  public String getText() {
    return text;
  }

  public String getStream() {
    return stream;
  }

  public String getTestId() {
    return testId;
  }

  public String getTestName() {
    return testName;
  }

  @Override
  public String toString() {
    return stream + ": " + text;
  }
}
