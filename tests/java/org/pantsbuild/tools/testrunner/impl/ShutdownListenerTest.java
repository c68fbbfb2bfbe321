// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

public class ShutdownListenerTest {
  private static final TestAction PASS = new TestAction() {
    @Override public void run(TestContext context) {
    }
  };

  @Test
  public void testReportsOnlyRunningTests() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ShutdownListener listener = new ShutdownListener(new PrintStream(out, true));
    TestNode done = TestNode.leaf("Suite#done", PASS).build();
    TestNode running = TestNode.leaf("Suite#running", PASS).build();
    TestNode suite = TestNode.composite("Suite").addChild(done).addChild(running).build();

    listener.testStarted(suite);
    listener.testStarted(done);
    listener.testStarted(running);
    listener.testFinished(TestResult.forLeaf(done, ResultState.SUCCESS, null, null, Duration.ZERO,
        ImmutableList.<TestOutput>of()));
    listener.unexpectedShutdown();

    String report = out.toString();
    assertThat(report, containsString("Suite#running -> FAILED: Abnormal VM exit - test crashed."));
    assertThat(report, not(containsString("Suite#done")));
    assertThat(report, not(containsString("Suite -> FAILED")));
  }
}
