// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;

/**
 * JUnit refuses to instantiate a test class with two public constructors. Run by the tree
 * builder tests.
 */
public class TwoConstructorsTest {
  public TwoConstructorsTest() {
  }

  public TwoConstructorsTest(String name) {
  }

  @Test
  public void testNeverRuns() {
    TestRegistry.registerTestCall("neverRuns");
  }
}
