// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

import java.time.Duration;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The immutable outcome of running one {@link TestNode}, including the results of its children.
 * <P>
 * Counts are taken over leaves only, so a suite of three test cases reports a total of three no
 * matter how deeply they are nested.
 * </P>
 */
public final class TestResult {
  static final String CHILD_ERRORS_MESSAGE = "One or more child tests had errors";

  private final TestNode test;
  private final ResultState state;
  @Nullable private final String message;
  @Nullable private final Throwable failure;
  private final Duration duration;
  private final ImmutableList<TestResult> children;
  private final ImmutableList<TestOutput> output;

  private final int passCount;
  private final int failCount;
  private final int errorCount;
  private final int inconclusiveCount;
  private final int skipCount;
  private final int cancelledCount;

  private TestResult(TestNode test, ResultState state, @Nullable String message,
      @Nullable Throwable failure, Duration duration, List<TestResult> children,
      List<TestOutput> output) {
    this.test = Preconditions.checkNotNull(test);
    this.state = Preconditions.checkNotNull(state);
    this.message = message;
    this.failure = failure;
    this.duration = Preconditions.checkNotNull(duration);
    this.children = ImmutableList.copyOf(children);
    this.output = ImmutableList.copyOf(output);

    if (test.isLeaf()) {
      passCount = state == ResultState.SUCCESS ? 1 : 0;
      failCount = state == ResultState.FAILURE ? 1 : 0;
      errorCount = state == ResultState.ERROR ? 1 : 0;
      inconclusiveCount = state == ResultState.INCONCLUSIVE ? 1 : 0;
      skipCount = state == ResultState.SKIPPED ? 1 : 0;
      cancelledCount = state == ResultState.CANCELLED ? 1 : 0;
    } else {
      int pass = 0;
      int fail = 0;
      int error = 0;
      int inconclusive = 0;
      int skip = 0;
      int cancelled = 0;
      for (TestResult child : this.children) {
        pass += child.passCount;
        fail += child.failCount;
        error += child.errorCount;
        inconclusive += child.inconclusiveCount;
        skip += child.skipCount;
        cancelled += child.cancelledCount;
      }
      passCount = pass;
      failCount = fail;
      errorCount = error;
      inconclusiveCount = inconclusive;
      skipCount = skip;
      cancelledCount = cancelled;
    }
  }

  /**
   * The result of a test case.
   */
  public static TestResult forLeaf(TestNode test, ResultState state, @Nullable String message,
      @Nullable Throwable failure, Duration duration, List<TestOutput> output) {
    Preconditions.checkArgument(test.isLeaf(), "%s is not a test case", test);
    return new TestResult(test, state, message, failure, duration, ImmutableList.<TestResult>of(),
        output);
  }

  /**
   * The result of a suite whose outcome is the aggregate of its children.
   */
  public static TestResult forComposite(TestNode test, List<TestResult> children,
      Duration duration) {
    List<ResultState> states = Lists.newArrayListWithCapacity(children.size());
    for (TestResult child : children) {
      states.add(child.getState());
    }
    ResultState state = ResultState.aggregate(states);
    String message = state == ResultState.FAILURE ? CHILD_ERRORS_MESSAGE : null;
    return forComposite(test, state, message, null, children, duration);
  }

  /**
   * The result of a suite with an explicitly decided outcome, as when its set-up failed or it was
   * cancelled.
   */
  public static TestResult forComposite(TestNode test, ResultState state, @Nullable String message,
      @Nullable Throwable failure, List<TestResult> children, Duration duration) {
    Preconditions.checkArgument(test.isComposite(), "%s is not a suite", test);
    return new TestResult(test, state, message, failure, duration, children,
        ImmutableList.<TestOutput>of());
  }

  /**
   * A result for {@code test} and every node beneath it, all sharing one outcome. Used for
   * subtrees that never ran: cancelled before they started, skipped, or below a failed set-up.
   */
  public static TestResult forSubtree(TestNode test, ResultState state, @Nullable String message) {
    if (test.isLeaf()) {
      return forLeaf(test, state, message, null, Duration.ZERO, ImmutableList.<TestOutput>of());
    }
    List<TestResult> children = Lists.newArrayListWithCapacity(test.getChildren().size());
    for (TestNode child : test.getChildren()) {
      children.add(forSubtree(child, state, message));
    }
    return forComposite(test, state, message, null, children, Duration.ZERO);
  }

  public TestNode getTest() {
    return test;
  }

  public ResultState getState() {
    return state;
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  @Nullable
  public Throwable getFailure() {
    return failure;
  }

  @Nullable
  public String getStackTrace() {
    return failure == null ? null : Throwables.getStackTraceAsString(failure);
  }

  public Duration getDuration() {
    return duration;
  }

  public ImmutableList<TestResult> getChildren() {
    return children;
  }

  public ImmutableList<TestOutput> getOutput() {
    return output;
  }

  public int getPassCount() {
    return passCount;
  }

  public int getFailCount() {
    return failCount;
  }

  public int getErrorCount() {
    return errorCount;
  }

  public int getInconclusiveCount() {
    return inconclusiveCount;
  }

  public int getSkipCount() {
    return skipCount;
  }

  public int getCancelledCount() {
    return cancelledCount;
  }

  public int getTotalCount() {
    return passCount + failCount + errorCount + inconclusiveCount + skipCount + cancelledCount;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(test.getName()).append(": ").append(state);
    if (message != null) {
      sb.append(" (").append(message).append(')');
    }
    return sb.toString();
  }
}
