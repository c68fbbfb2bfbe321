// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;

import static org.junit.Assert.fail;

/**
 * Run by the console runner tests; not run on its own.
 */
public class AllFailingTest {
  @Test
  public void test1() {
    fail("failing test1");
  }

  @Test
  public void test2() {
    fail("failing test2");
  }

  @Test
  public void test3() {
    fail("failing test3");
  }

  @Test
  public void test4() {
    fail("failing test4");
  }
}
