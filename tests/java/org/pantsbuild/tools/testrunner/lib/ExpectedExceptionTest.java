// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;

/**
 * Exercises {@literal @Test(expected)}. Run by the tree builder tests.
 */
public class ExpectedExceptionTest {
  @Test(expected = IllegalArgumentException.class)
  public void testExpectedThrown() {
    throw new IllegalArgumentException("as expected");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNothingThrown() {
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongTypeThrown() {
    throw new IllegalStateException("surprise");
  }
}
