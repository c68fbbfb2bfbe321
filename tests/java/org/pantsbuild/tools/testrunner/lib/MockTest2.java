// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;
import org.pantsbuild.testrunner.annotations.TestSerial;

/**
 * Run by the console runner tests; not run on its own.
 */
@TestSerial
public class MockTest2 {
  @Test
  public void testMethod21() {
    TestRegistry.registerTestCall("test21");
  }

  @Test
  public void testMethod22() {
    TestRegistry.registerTestCall("test22");
  }
}
