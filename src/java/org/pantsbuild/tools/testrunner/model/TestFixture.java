// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

/**
 * A suite's one-time fixture that has to stay in place while the suite's children run, as class
 * rules do. It is given the children as an action to call at most once; a fault thrown before
 * that call counts as a failed set-up, one thrown after it as a failed tear-down.
 */
public interface TestFixture {
  void run(TestContext context, TestAction children) throws Throwable;
}
