// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;

/**
 * Run by the console runner tests; not run on its own.
 */
public class TimeoutTest {
  @Test(timeout = 100)
  public void testSleepsTooLong() throws Exception {
    Thread.sleep(10000);
  }

  @Test
  public void testQuick() {
    TestRegistry.registerTestCall("quick");
  }
}
