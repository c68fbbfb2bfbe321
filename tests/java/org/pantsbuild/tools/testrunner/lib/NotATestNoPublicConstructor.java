// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import org.junit.Test;

/**
 * Has no public constructor, so not a runnable test class.
 */
public class NotATestNoPublicConstructor {
  private NotATestNoPublicConstructor() {
  }

  @Test
  public void testMethod() {
  }
}
