// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.internal.AssumptionViolatedException;
import org.pantsbuild.tools.testrunner.model.ApartmentState;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestFixture;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * A schedulable unit wrapping one {@link TestNode}, its execution state and its result.
 * <P>
 * {@link #execute()} runs on the worker that dequeued the item and always leaves the item
 * {@link WorkItemState#COMPLETE}: every fault in the test body becomes a recorded result.
 * {@link #cancel(boolean)} may be called from any thread at any time. A forced cancel completes
 * the item on the calling thread; whatever the abandoned body produces afterwards is discarded.
 * </P>
 */
public class WorkItem {
  private static final Logger logger = Logger.getLogger(WorkItem.class.getName());

  static final String CANCELLED_MESSAGE = "Test cancelled";
  static final String NOT_STARTED_MESSAGE = "Test cancelled before it started";
  static final String NOT_RUN_BY_FIXTURE_MESSAGE = "Not run by its suite's fixture";

  /**
   * Called once the item's result is published, before threads blocked in
   * {@link #awaitCompletion} are released.
   */
  public interface CompletionListener {
    void workItemCompleted(WorkItem item);
  }

  private final TestNode test;
  private final WorkItemDispatcher dispatcher;
  private final CountDownLatch completed = new CountDownLatch(1);
  private final AtomicBoolean queued = new AtomicBoolean(false);

  private final Object stateLock = new Object();
  // All guarded by stateLock.
  private WorkItemState state = WorkItemState.NOT_STARTED;
  private final List<CompletionListener> completionListeners = Lists.newArrayList();
  @Nullable private ImmutableList<WorkItem> children;
  @Nullable private Thread bodyThread;
  @Nullable private String workerName;
  // Set once an abort claims the item; the outcome execute() reaches is then dropped.
  private boolean aborting;

  private volatile boolean cancelRequested;
  private volatile long startNanos;
  private volatile TestResult result;

  public WorkItem(TestNode test, WorkItemDispatcher dispatcher) {
    this.test = Preconditions.checkNotNull(test);
    this.dispatcher = Preconditions.checkNotNull(dispatcher);
  }

  public TestNode getTest() {
    return test;
  }

  public String getId() {
    return test.getId();
  }

  public String getName() {
    return test.getName();
  }

  public WorkItemState getState() {
    synchronized (stateLock) {
      return state;
    }
  }

  public boolean isComplete() {
    return completed.getCount() == 0;
  }

  /**
   * The result, or {@code null} until the item is complete.
   */
  @Nullable
  public TestResult getResult() {
    return result;
  }

  /**
   * The name of the worker executing this item, or {@code null} if none is.
   */
  @Nullable
  public String getWorkerName() {
    synchronized (stateLock) {
      return workerName;
    }
  }

  void setWorkerName(@Nullable String workerName) {
    synchronized (stateLock) {
      if (state != WorkItemState.COMPLETE) {
        this.workerName = workerName;
      }
    }
  }

  public boolean isCancellationRequested() {
    return cancelRequested;
  }

  /**
   * The child items, empty until a composite starts running.
   */
  public ImmutableList<WorkItem> getChildren() {
    synchronized (stateLock) {
      return children == null ? ImmutableList.<WorkItem>of() : children;
    }
  }

  /**
   * Registers a callback for completion. If the item is already complete, the callback runs
   * immediately on the calling thread.
   */
  public void addCompletionListener(CompletionListener listener) {
    Preconditions.checkNotNull(listener);
    synchronized (stateLock) {
      if (state != WorkItemState.COMPLETE) {
        completionListeners.add(listener);
        return;
      }
    }
    listener.workItemCompleted(this);
  }

  public void awaitCompletion() throws InterruptedException {
    completed.await();
  }

  public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
    return completed.await(timeout, unit);
  }

  // Enforces that an item sits in at most one queue at a time.
  boolean markQueued() {
    return queued.compareAndSet(false, true);
  }

  void markDequeued() {
    queued.set(false);
  }

  /**
   * Runs the test. Returns once the item is complete and never throws for a test fault.
   *
   * @throws IllegalStateException If the item has already been executed.
   */
  public void execute() {
    synchronized (stateLock) {
      if (state == WorkItemState.COMPLETE || aborting) {
        // Force-cancelled while it sat in a queue, or an abort is completing it.
        return;
      }
      Preconditions.checkState(state == WorkItemState.NOT_STARTED,
          "%s has already been executed", test);
      state = WorkItemState.RUNNING;
      startNanos = System.nanoTime();
    }

    TestResult outcome;
    try {
      notifyStarted();
      if (cancelRequested) {
        outcome = TestResult.forSubtree(test, ResultState.CANCELLED, NOT_STARTED_MESSAGE);
      } else if (test.isIgnored()) {
        outcome = TestResult.forSubtree(test, ResultState.SKIPPED, test.getIgnoreReason());
      } else {
        switch (test.getKind()) {
          case LEAF:
            outcome = runLeaf();
            break;
          case COMPOSITE:
            outcome = runComposite();
            break;
          default:
            throw new IllegalStateException("Unhandled kind " + test.getKind());
        }
      }
    } catch (InterruptedException e) {
      outcome = faultResult(new SchedulerException(
          "Interrupted while waiting for the children of " + test, e));
    } catch (RuntimeException | Error e) {
      logger.log(Level.WARNING, "Internal fault while executing " + test, e);
      outcome = faultResult(e);
    }
    finish(outcome);
  }

  /**
   * Cancels this item and, through it, its descendants.
   *
   * @param force {@code true} to complete the item at once with a cancelled result and abandon any
   *     running body; {@code false} to let a running test case finish and stop anything that has
   *     not yet started.
   */
  public void cancel(boolean force) {
    if (force) {
      abort(ResultState.CANCELLED, CANCELLED_MESSAGE);
    } else {
      cancelGracefully();
    }
  }

  private void cancelGracefully() {
    List<WorkItem> toCancel;
    synchronized (stateLock) {
      if (state == WorkItemState.COMPLETE || cancelRequested) {
        return;
      }
      cancelRequested = true;
      if (state == WorkItemState.RUNNING) {
        state = WorkItemState.CANCELLING;
      }
      toCancel = children;
    }
    if (toCancel != null) {
      for (WorkItem child : toCancel) {
        child.cancel(false);
      }
    }
  }

  /**
   * Completes this item immediately with {@code outcome}, force-cancelling its children. Used by
   * a forced cancel and by the timeout policy. Whatever a running body produces afterwards is
   * discarded.
   */
  void abort(ResultState outcome, String message) {
    List<WorkItem> toCancel;
    TestResult aborted = null;
    List<CompletionListener> toNotify = null;
    synchronized (stateLock) {
      if (state == WorkItemState.COMPLETE || aborting) {
        return;
      }
      aborting = true;
      cancelRequested = true;
      toCancel = children;
      if (test.isLeaf()) {
        aborted = TestResult.forLeaf(test, outcome, message, null, elapsed(),
            ImmutableList.<TestOutput>of());
        toNotify = publish(aborted);
        // The result is in place before the body sees the interrupt, so nothing the body does
        // once interrupted can replace it.
        if (bodyThread != null) {
          bodyThread.interrupt();
        }
      }
    }

    if (aborted == null) {
      if (toCancel == null) {
        aborted = TestResult.forSubtree(test, outcome, message);
      } else {
        for (WorkItem child : toCancel) {
          child.cancel(true);
        }
        aborted = TestResult.forComposite(test, outcome, message, null, childResults(toCancel),
            elapsed());
      }
      synchronized (stateLock) {
        toNotify = publish(aborted);
      }
    }
    notifyCompleted(aborted, toNotify);
  }

  private TestResult runLeaf() {
    ItemContext context = new ItemContext();
    Throwable thrown = null;
    synchronized (stateLock) {
      if (aborting) {
        return result;
      }
      bodyThread = Thread.currentThread();
    }
    try {
      test.getAction().run(context);
    } catch (Throwable t) {
      thrown = t;
    } finally {
      synchronized (stateLock) {
        bodyThread = null;
      }
      // No interrupt can arrive past this point; clear any aimed at the body.
      Thread.interrupted();
    }
    return TestResult.forLeaf(test, classify(thrown), describe(thrown), thrown, elapsed(),
        context.getOutput());
  }

  private TestResult runComposite() throws InterruptedException {
    TestAction setUp = test.getSetUp();
    if (setUp != null) {
      Throwable thrown = runFixtureAction(setUp);
      if (thrown != null) {
        return setUpFailed(thrown);
      }
    }

    ChildrenAction children = new ChildrenAction();
    TestFixture fixture = test.getFixture();
    Throwable fixtureFault = null;
    if (fixture == null) {
      children.run(null);
    } else {
      try {
        fixture.run(new ItemContext(), children);
      } catch (Throwable t) {
        fixtureFault = t;
      }
      if (children.interrupted != null) {
        throw children.interrupted;
      }
      if (!children.started) {
        if (fixtureFault != null) {
          return setUpFailed(fixtureFault);
        }
        return notRunByFixture();
      }
    }

    List<TestResult> childResults = childResults(children.created);
    TestAction tearDown = test.getTearDown();
    if (tearDown != null) {
      Throwable thrown = runFixtureAction(tearDown);
      if (thrown != null && fixtureFault == null) {
        fixtureFault = thrown;
      }
    }
    if (fixtureFault != null) {
      return TestResult.forComposite(test, ResultState.ERROR,
          "OneTimeTearDown: " + describe(fixtureFault), fixtureFault, childResults, elapsed());
    }
    return TestResult.forComposite(test, childResults, elapsed());
  }

  private TestResult setUpFailed(Throwable thrown) {
    ResultState outcome = classify(thrown);
    String message = "OneTimeSetUp: " + describe(thrown);
    List<TestResult> skipped = Lists.newArrayList();
    for (TestNode child : test.getChildren()) {
      skipped.add(TestResult.forSubtree(child, outcome, message));
    }
    return TestResult.forComposite(test, outcome, message, thrown, skipped, elapsed());
  }

  private TestResult notRunByFixture() {
    List<TestResult> skipped = Lists.newArrayList();
    for (TestNode child : test.getChildren()) {
      skipped.add(TestResult.forSubtree(child, ResultState.SKIPPED, NOT_RUN_BY_FIXTURE_MESSAGE));
    }
    return TestResult.forComposite(test, skipped, elapsed());
  }

  /**
   * Creates, dispatches and waits for the children. Handed to a suite's fixture so that the
   * children run wherever the fixture calls it.
   */
  private final class ChildrenAction implements TestAction {
    private List<WorkItem> created = ImmutableList.of();
    private boolean started;
    @Nullable private InterruptedException interrupted;

    @Override
    public void run(@Nullable TestContext context) throws InterruptedException {
      Preconditions.checkState(!started, "The children of %s can only run once", test);
      started = true;
      created = createChildren();
      if (!created.isEmpty()) {
        dispatcher.dispatch(WorkItem.this, created);
        try {
          dispatcher.awaitChildren(WorkItem.this, created);
        } catch (InterruptedException e) {
          interrupted = e;
          throw e;
        }
      }
    }
  }

  @Nullable
  private Throwable runFixtureAction(TestAction action) {
    try {
      action.run(new ItemContext());
      return null;
    } catch (Throwable t) {
      return t;
    }
  }

  private List<WorkItem> createChildren() {
    synchronized (stateLock) {
      if (state == WorkItemState.COMPLETE) {
        return ImmutableList.of();
      }
      ImmutableList.Builder<WorkItem> created = ImmutableList.builder();
      for (TestNode child : test.getChildren()) {
        WorkItem item = new WorkItem(child, dispatcher);
        item.cancelRequested = cancelRequested;
        created.add(item);
      }
      children = created.build();
      return children;
    }
  }

  private static List<TestResult> childResults(List<WorkItem> items) {
    List<TestResult> results = Lists.newArrayListWithCapacity(items.size());
    for (WorkItem item : items) {
      TestResult childResult = item.getResult();
      results.add(childResult != null
          ? childResult
          : TestResult.forSubtree(item.getTest(), ResultState.CANCELLED, CANCELLED_MESSAGE));
    }
    return results;
  }

  private TestResult faultResult(Throwable fault) {
    if (test.isLeaf()) {
      return TestResult.forLeaf(test, ResultState.ERROR, describe(fault), fault, elapsed(),
          ImmutableList.<TestOutput>of());
    }
    return TestResult.forComposite(test, ResultState.ERROR, describe(fault), fault,
        childResults(getChildren()), elapsed());
  }

  // Publishes the outcome of execute(), unless an abort has claimed the item.
  private void finish(TestResult outcome) {
    List<CompletionListener> toNotify;
    synchronized (stateLock) {
      if (aborting) {
        return;
      }
      toNotify = publish(outcome);
    }
    notifyCompleted(outcome, toNotify);
  }

  // Caller holds stateLock.
  private List<CompletionListener> publish(TestResult outcome) {
    Preconditions.checkState(state != WorkItemState.COMPLETE, "%s is already complete", test);
    result = outcome;
    state = WorkItemState.COMPLETE;
    workerName = null;
    List<CompletionListener> toNotify = ImmutableList.copyOf(completionListeners);
    completionListeners.clear();
    return toNotify;
  }

  private void notifyCompleted(TestResult outcome, List<CompletionListener> toNotify) {
    try {
      try {
        dispatcher.getListener().testFinished(outcome);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed on completion of " + test, e);
      }
    } finally {
      try {
        for (CompletionListener listener : toNotify) {
          listener.workItemCompleted(this);
        }
      } finally {
        completed.countDown();
      }
    }
  }

  private void notifyStarted() {
    try {
      dispatcher.getListener().testStarted(test);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Listener failed on start of " + test, e);
    }
  }

  private Duration elapsed() {
    long start = startNanos;
    return start == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - start);
  }

  @VisibleForTesting
  static ResultState classify(@Nullable Throwable thrown) {
    if (thrown == null) {
      return ResultState.SUCCESS;
    }
    if (thrown instanceof AssumptionViolatedException) {
      return ResultState.INCONCLUSIVE;
    }
    if (thrown instanceof AssertionError) {
      return ResultState.FAILURE;
    }
    return ResultState.ERROR;
  }

  @Nullable
  private static String describe(@Nullable Throwable thrown) {
    if (thrown == null) {
      return null;
    }
    if (thrown instanceof AssertionError || thrown instanceof AssumptionViolatedException) {
      return thrown.getMessage();
    }
    return thrown.toString();
  }

  @Override
  public String toString() {
    return test.getName();
  }

  private class ItemContext implements TestContext {
    private final List<TestOutput> output = Lists.newArrayList();

    @Override
    public TestNode getTest() {
      return test;
    }

    @Override
    public boolean isCancellationRequested() {
      return cancelRequested;
    }

    @Override
    public ApartmentState getApartment() {
      return TestWorker.currentApartment();
    }

    @Override
    public void write(String stream, String text) {
      TestOutput line = new TestOutput(text, stream, test.getId(), test.getName());
      synchronized (output) {
        output.add(line);
      }
      try {
        dispatcher.getListener().testOutput(line);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed on output of " + test, e);
      }
    }

    List<TestOutput> getOutput() {
      synchronized (output) {
        return ImmutableList.copyOf(output);
      }
    }
  }
}
