// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.time.Duration;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.easymock.IMocksControl;
import org.junit.Before;
import org.junit.Test;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

import static org.easymock.EasyMock.createStrictControl;

public class ForwardingListenerTest {
  private static final TestAction PASS = new TestAction() {
    @Override public void run(TestContext context) {
    }
  };

  private IMocksControl control;
  private ExecutionListener first;
  private ExecutionListener second;
  private ForwardingListener forwarding;

  @Before
  public void setUp() {
    control = createStrictControl();
    first = control.createMock(ExecutionListener.class);
    second = control.createMock(ExecutionListener.class);
    forwarding = new ForwardingListener();
    forwarding.addListener(first);
    forwarding.addListener(second);
  }

  @Test
  public void testForwardsEveryEventInRegistrationOrder() {
    TestNode test = TestNode.leaf("a", PASS).build();
    List<TestNode> roots = ImmutableList.of(test);
    TestOutput output = new TestOutput("hi", TestOutput.OUT, "a", "a");
    TestResult result = TestResult.forLeaf(test, ResultState.SUCCESS, null, null, Duration.ZERO,
        ImmutableList.<TestOutput>of());
    List<TestResult> results = ImmutableList.of(result);

    first.runStarted(roots);
    second.runStarted(roots);
    first.testStarted(test);
    second.testStarted(test);
    first.testOutput(output);
    second.testOutput(output);
    first.testFinished(result);
    second.testFinished(result);
    first.runFinished(results);
    second.runFinished(results);
    control.replay();

    forwarding.runStarted(roots);
    forwarding.testStarted(test);
    forwarding.testOutput(output);
    forwarding.testFinished(result);
    forwarding.runFinished(results);

    control.verify();
  }

  @Test(expected = NullPointerException.class)
  public void testRejectsNullListener() {
    forwarding.addListener(null);
  }
}
