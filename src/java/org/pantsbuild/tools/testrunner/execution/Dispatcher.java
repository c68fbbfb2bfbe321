// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.pantsbuild.tools.testrunner.model.ApartmentState;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * Runs test trees on a pool of {@link TestWorker TestWorkers}.
 * <P>
 * The dispatcher keeps a stack of {@link QueueSet QueueSets}. The bottom set holds the roots of the
 * run. When a worker picks up a composite that declares an isolation boundary, the set on top of
 * the stack is paused and a fresh set, with workers of its own, is pushed for the composite's
 * children. Once the composite is idle and everything enqueued into its set has completed, that
 * set is removed from the stack and the set below resumes. Children of other composites share the
 * set their parent was enqueued into.
 * </P>
 * <P>
 * A dispatcher runs once. Progress is reported to the listeners added with
 * {@link #addListener(ExecutionListener)}.
 * </P>
 */
public class Dispatcher {
  private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

  private static final long ROOT_POLL_MILLIS = 50;

  /**
   * Where a child item is sent to run.
   */
  @VisibleForTesting
  enum Route {
    PARALLEL,
    NON_PARALLEL,
    APARTMENT,
    /** Run in order on the parent's own worker, without queueing. */
    DIRECT
  }

  private final DispatcherSettings settings;
  private final ForwardingListener listener = new ForwardingListener();
  private final TimeoutPolicy timeoutPolicy;
  private final Events events = new Events();

  private final AtomicBoolean used = new AtomicBoolean(false);
  private final AtomicBoolean apartmentWarningLogged = new AtomicBoolean(false);
  private final AtomicInteger workerIds = new AtomicInteger();
  private final AtomicInteger setIds = new AtomicInteger();
  private final List<TestWorker> workers = new CopyOnWriteArrayList<TestWorker>();
  // Workers left stuck in an aborted test case; shutdown does not wait for them.
  private final Set<TestWorker> retired = Sets.newConcurrentHashSet();

  private final Object stackLock = new Object();
  // All guarded by stackLock.
  private final Deque<QueueSet> stack = new ArrayDeque<QueueSet>();
  private final List<QueueSet> allSets = Lists.newArrayList();
  private final Map<WorkItem, QueueSet> pushedSets = Maps.newIdentityHashMap();
  private final Map<WorkItem, QueueSet> homeSets = Maps.newIdentityHashMap();
  private final Set<QueueSet> pendingRestores = Sets.newIdentityHashSet();

  private volatile ImmutableList<WorkItem> roots = ImmutableList.of();
  private volatile boolean stopping;
  @Nullable private volatile SchedulerException fatalError;

  public Dispatcher() {
    this(DispatcherSettings.defaults());
  }

  public Dispatcher(DispatcherSettings settings) {
    this.settings = Preconditions.checkNotNull(settings);
    this.timeoutPolicy = new TimeoutPolicy(settings.getCancelGracePeriodMillis(), events);
  }

  public DispatcherSettings getSettings() {
    return settings;
  }

  public void addListener(ExecutionListener executionListener) {
    listener.addListener(executionListener);
  }

  /**
   * Every worker started so far, including ones that have since stopped.
   */
  public List<TestWorker> getWorkers() {
    return ImmutableList.copyOf(workers);
  }

  public int getActiveWorkerCount() {
    int active = 0;
    for (TestWorker worker : workers) {
      if (worker.isAlive()) {
        active++;
      }
    }
    return active;
  }

  /**
   * The number of queue sets currently on the stack, the roots' set included.
   */
  @VisibleForTesting
  int getStackDepth() {
    synchronized (stackLock) {
      return stack.size();
    }
  }

  /**
   * The root items of the run, empty until {@link #run} is called.
   */
  public List<WorkItem> getRoots() {
    return roots;
  }

  public TestResult run(TestNode root) {
    return run(ImmutableList.of(root)).get(0);
  }

  /**
   * Runs the given trees to completion and returns their results, in the same order.
   *
   * @throws IllegalStateException If this dispatcher has already run.
   * @throws RunAbortedException If the scheduler failed, for example because a worker died. The
   *     exception carries whatever results were reached.
   */
  public List<TestResult> run(List<TestNode> tests) {
    Preconditions.checkNotNull(tests);
    Preconditions.checkState(used.compareAndSet(false, true), "A Dispatcher can only run once");

    ImmutableList.Builder<WorkItem> items = ImmutableList.builder();
    for (TestNode test : tests) {
      items.add(new WorkItem(test, events));
    }
    roots = items.build();
    logger.fine(String.format("Running %d root(s) with %s", roots.size(), settings));
    listener.runStarted(ImmutableList.copyOf(tests));

    QueueSet rootSet;
    synchronized (stackLock) {
      rootSet = newQueueSet(null, tests);
      stack.push(rootSet);
    }
    for (WorkItem root : roots) {
      enqueue(rootSet, root, route(root.getTest(), false));
    }

    try {
      awaitRoots();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(true);
      shutdown();
      throw new RunAbortedException("Interrupted while waiting for the run to finish", e,
          collectResults());
    }

    if (fatalError != null) {
      cancel(true);
    }
    shutdown();
    // A worker may die while the others are being joined.
    SchedulerException fatal = fatalError;
    if (fatal != null) {
      logger.log(Level.SEVERE, "Aborting test run", fatal);
      throw new RunAbortedException("Test run aborted: " + fatal.getMessage(), fatal,
          collectResults());
    }

    List<TestResult> results = collectResults();
    listener.runFinished(results);
    return results;
  }

  private void awaitRoots() throws InterruptedException {
    for (WorkItem root : roots) {
      while (!root.awaitCompletion(ROOT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (fatalError != null) {
          return;
        }
      }
    }
  }

  private List<TestResult> collectResults() {
    ImmutableList.Builder<TestResult> results = ImmutableList.builder();
    for (WorkItem root : roots) {
      TestResult result = root.getResult();
      results.add(result != null
          ? result
          : TestResult.forSubtree(root.getTest(), ResultState.CANCELLED,
              WorkItem.CANCELLED_MESSAGE));
    }
    return results.build();
  }

  /**
   * Cancels the run.
   *
   * @param force {@code true} to complete every unfinished test as cancelled right away and stop
   *     all workers; {@code false} to let running test cases finish while nothing new starts.
   */
  public void cancel(boolean force) {
    logger.info(force ? "Forcing the test run to stop" : "Cancelling the test run");
    if (force) {
      stopping = true;
      for (TestWorker worker : workers) {
        worker.cancel(true);
      }
      for (WorkItem root : roots) {
        root.cancel(true);
      }
      stopAllQueues();
    } else {
      for (WorkItem root : roots) {
        root.cancel(false);
      }
      for (TestWorker worker : workers) {
        worker.cancel(false);
      }
    }
  }

  private void stopAllQueues() {
    synchronized (stackLock) {
      for (QueueSet set : allSets) {
        set.stop();
      }
    }
  }

  private void shutdown() {
    stopping = true;
    stopAllQueues();
    timeoutPolicy.shutdown();

    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getWorkerJoinMillis());
    for (TestWorker worker : workers) {
      if (isAbandoned(worker)) {
        logger.fine(String.format("Not waiting for %s, which is stuck in an aborted test",
            worker.getName()));
        continue;
      }
      long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      try {
        if (!worker.join(Math.max(1, remaining))) {
          logger.warning(worker.getName() + " did not stop; leaving it behind");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warning("Interrupted while stopping workers");
        return;
      }
    }
  }

  private boolean isAbandoned(TestWorker worker) {
    if (retired.contains(worker)) {
      return true;
    }
    WorkItem current = worker.getCurrentWorkItem();
    return current != null && current.getTest().isLeaf() && current.isComplete();
  }

  @VisibleForTesting
  Route route(TestNode child, boolean onWorker) {
    ApartmentState apartment = child.getRequiredApartment();
    if (apartment.isRequirement()) {
      if (settings.isApartmentsSupported()) {
        return Route.APARTMENT;
      }
      if (apartmentWarningLogged.compareAndSet(false, true)) {
        logger.warning(String.format(
            "Apartment threads are not supported; running %s and any other test requiring an"
                + " apartment without one", child.getName()));
      }
      return Route.PARALLEL;
    }
    if (child.isParallelizable() || settings.getLevelOfParallelism() == 1) {
      return Route.PARALLEL;
    }
    if (onWorker && child.isLeaf() && timeoutFor(child) == 0) {
      return Route.DIRECT;
    }
    return Route.NON_PARALLEL;
  }

  private long timeoutFor(TestNode test) {
    return test.getTimeoutMillis() > 0 ? test.getTimeoutMillis() : settings.getDefaultTimeoutMillis();
  }

  // Caller holds stackLock.
  private QueueSet newQueueSet(@Nullable WorkItem owner, List<TestNode> scope) {
    int parallelWorkers = Math.max(1,
        Math.min(settings.getLevelOfParallelism(), parallelDemand(scope)));
    String name = owner == null
        ? "Root"
        : String.format("Isolated-%d[%s]", setIds.incrementAndGet(), owner.getName());
    QueueSet set = new QueueSet(name, owner, parallelWorkers, events);
    allSets.add(set);
    if (stopping) {
      set.stop();
    }
    return set;
  }

  /**
   * Counts the parallelizable nodes whose work lands in the same queue set as {@code nodes}, that
   * is without descending into isolation boundaries.
   */
  @VisibleForTesting
  static int parallelDemand(List<TestNode> nodes) {
    int demand = 0;
    for (TestNode node : nodes) {
      if (node.isParallelizable()) {
        demand++;
      }
      if (node.isComposite() && !node.isIsolationBoundary()) {
        demand += parallelDemand(node.getChildren());
      }
    }
    return demand;
  }

  private void enqueue(final QueueSet set, WorkItem item, Route route) {
    Preconditions.checkArgument(route != Route.DIRECT, "%s is not queued", item);
    synchronized (stackLock) {
      homeSets.put(item, set);
    }
    QueueSet.Lane lane;
    switch (route) {
      case APARTMENT:
        lane = QueueSet.Lane.APARTMENT;
        break;
      case NON_PARALLEL:
        lane = QueueSet.Lane.NON_PARALLEL;
        break;
      default:
        lane = QueueSet.Lane.PARALLEL;
        break;
    }
    try {
      set.enqueue(item, lane, item.getTest().getRequiredApartment());
    } catch (IllegalStateException e) {
      synchronized (stackLock) {
        homeSets.remove(item);
      }
      if (!stopping) {
        throw e;
      }
      // The run is stopping and the set is gone with it.
      item.cancel(true);
      return;
    }
    item.addCompletionListener(new WorkItem.CompletionListener() {
      @Override
      public void workItemCompleted(WorkItem completed) {
        synchronized (stackLock) {
          homeSets.remove(completed);
        }
        set.itemCompleted();
      }
    });
  }

  private void pushQueueSet(WorkItem owner) {
    synchronized (stackLock) {
      if (stopping || pushedSets.containsKey(owner)) {
        return;
      }
      QueueSet pushed = newQueueSet(owner, owner.getTest().getChildren());
      QueueSet previous = stack.peek();
      if (previous != null) {
        previous.pause();
      }
      stack.push(pushed);
      pushedSets.put(owner, pushed);
      logger.fine(String.format("Pushed %s with %d parallel worker(s) over %s",
          pushed, pushed.getParallelWorkers(), previous));
    }
  }

  // Caller holds stackLock.
  private boolean tryRestore(QueueSet set) {
    if (!set.isDrained()) {
      return false;
    }
    boolean wasTop = stack.peek() == set;
    stack.removeFirstOccurrence(set);
    pushedSets.remove(set.getOwner());
    pendingRestores.remove(set);
    set.stop();
    QueueSet top = stack.peek();
    if (wasTop && top != null) {
      top.resume();
    }
    logger.fine(String.format("Restored %s; %s is on top", set, top));
    return true;
  }

  // Caller holds stackLock.
  private void retryPendingRestores() {
    for (QueueSet set : ImmutableList.copyOf(pendingRestores)) {
      tryRestore(set);
    }
  }

  private TestWorker startWorker(WorkItemQueue queue) {
    TestWorker worker = new TestWorker(queue,
        String.format("%s#%d", queue.getName(), workerIds.incrementAndGet()), events);
    workers.add(worker);
    worker.start();
    return worker;
  }

  private void replaceWorker(TestWorker stuck, WorkItem item) {
    if (stopping || !settings.isReplaceAbandonedWorkers()) {
      return;
    }
    retired.add(stuck);
    stuck.cancel(true);
    TestWorker replacement = startWorker(stuck.getWorkQueue());
    logger.warning(String.format("%s is stuck in %s, which was aborted; replaced it with %s",
        stuck.getName(), item.getName(), replacement.getName()));
  }

  /**
   * The dispatcher's side of the worker and work item protocols. Kept off the public API.
   */
  private class Events implements TestWorkerListener, WorkItemDispatcher, QueueSet.Host,
      TimeoutPolicy.StuckWorkerHandler {

    @Override
    public void busy(TestWorker worker, WorkItem item) {
      TestNode test = item.getTest();
      if (item.isComplete()) {
        return;
      }
      if (test.isIsolationBoundary()) {
        pushQueueSet(item);
      } else if (test.isLeaf()) {
        long timeout = timeoutFor(test);
        if (timeout > 0) {
          timeoutPolicy.arm(item, worker, timeout);
        }
      }
    }

    @Override
    public void idle(TestWorker worker, WorkItem item) {
      synchronized (stackLock) {
        QueueSet owned = pushedSets.get(item);
        if (owned != null && !tryRestore(owned)) {
          pendingRestores.add(owned);
          logger.fine(String.format("Deferring restore of %s: %d item(s) outstanding",
              owned, owned.getOutstanding()));
        }
        retryPendingRestores();
      }
    }

    @Override
    public void stopped(TestWorker worker, @Nullable Throwable cause) {
      if (cause != null) {
        synchronized (stackLock) {
          if (fatalError == null) {
            fatalError = new SchedulerException(worker.getName() + " died", cause);
          }
        }
      }
    }

    @Override
    public boolean handOff(TestWorker worker, WorkItem item) {
      if (!item.getTest().isLeaf() || timeoutFor(item.getTest()) == 0) {
        return false;
      }
      QueueSet home;
      synchronized (stackLock) {
        home = homeSets.get(item);
      }
      if (home == null) {
        return false;
      }
      try {
        home.handOff(item, worker.getWorkQueue());
      } catch (IllegalStateException e) {
        // The run is stopping and the set is gone with it.
        item.cancel(true);
        return true;
      }
      logger.fine(String.format("%s handed %s off to run under its timeout", worker.getName(),
          item.getName()));
      return true;
    }

    @Override
    public void dispatch(WorkItem parent, List<WorkItem> children) {
      QueueSet target;
      synchronized (stackLock) {
        target = pushedSets.get(parent);
        if (target == null) {
          target = homeSets.get(parent);
        }
      }
      if (target == null) {
        if (!stopping && !parent.isComplete()) {
          throw new SchedulerException("No queue set to run the children of " + parent);
        }
        for (WorkItem child : children) {
          child.cancel(true);
        }
        return;
      }
      boolean onWorker = TestWorker.current() != null;
      for (WorkItem child : children) {
        Route route = route(child.getTest(), onWorker);
        if (route != Route.DIRECT) {
          enqueue(target, child, route);
        }
      }
    }

    @Override
    public void awaitChildren(final WorkItem parent, final List<WorkItem> children)
        throws InterruptedException {
      BooleanSupplier done = new BooleanSupplier() {
        @Override
        public boolean getAsBoolean() {
          if (parent.isComplete()) {
            return true;
          }
          for (WorkItem child : children) {
            if (!child.isComplete()) {
              return false;
            }
          }
          return true;
        }
      };

      TestWorker worker = TestWorker.current();
      if (worker == null) {
        while (!done.getAsBoolean()) {
          for (WorkItem child : children) {
            child.awaitCompletion(ROOT_POLL_MILLIS, TimeUnit.MILLISECONDS);
          }
        }
        return;
      }
      for (WorkItem child : children) {
        if (route(child.getTest(), true) == Route.DIRECT && !parent.isComplete()) {
          worker.runDirect(child);
        }
      }
      worker.helpUntil(done);
    }

    @Override
    public ExecutionListener getListener() {
      return listener;
    }

    @Override
    public TestWorker startWorker(WorkItemQueue queue) {
      return Dispatcher.this.startWorker(queue);
    }

    @Override
    public void drained(QueueSet set) {
      synchronized (stackLock) {
        if (pendingRestores.contains(set)) {
          tryRestore(set);
        }
      }
    }

    @Override
    public void workerStuck(TestWorker worker, WorkItem item) {
      replaceWorker(worker, item);
    }
  }
}
