// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.pantsbuild.tools.testrunner.model.ApartmentState;

/**
 * A TestWorker owns one thread that pulls {@link WorkItem WorkItems} from a queue and executes
 * them, announcing each one to its {@link TestWorkerListener} before and after.
 */
public class TestWorker {
  private static final Logger logger = Logger.getLogger(TestWorker.class.getName());

  private static final long HELP_POLL_MILLIS = 20;

  private static final ThreadLocal<TestWorker> CURRENT = new ThreadLocal<TestWorker>();

  private final WorkItemQueue workQueue;
  private final String name;
  private final TestWorkerListener listener;
  private final AtomicInteger workItemCount = new AtomicInteger();

  private final Object cancelLock = new Object();
  // Guarded by cancelLock.
  @Nullable private WorkItem currentWorkItem;
  private final Set<WorkItem> abandoned = Sets.newIdentityHashSet();

  private volatile boolean running;
  private volatile ApartmentState apartment = ApartmentState.UNKNOWN;
  @Nullable private volatile Thread workerThread;
  @Nullable private volatile Throwable failure;

  /**
   * @param queue The queue to pull work from.
   * @param name The name of this worker, also used for its thread.
   * @param listener Receives this worker's busy, idle and stopped callbacks.
   */
  public TestWorker(WorkItemQueue queue, String name, TestWorkerListener listener) {
    this.workQueue = Preconditions.checkNotNull(queue);
    this.name = Preconditions.checkNotNull(name);
    this.listener = Preconditions.checkNotNull(listener);
  }

  /**
   * The worker whose thread is calling, or {@code null} off the worker threads.
   */
  @Nullable
  public static TestWorker current() {
    return CURRENT.get();
  }

  /**
   * The apartment of the calling worker thread; {@link ApartmentState#UNKNOWN} elsewhere.
   */
  public static ApartmentState currentApartment() {
    TestWorker worker = CURRENT.get();
    return worker == null ? ApartmentState.UNKNOWN : worker.apartment;
  }

  public WorkItemQueue getWorkQueue() {
    return workQueue;
  }

  public String getName() {
    return name;
  }

  public boolean isAlive() {
    Thread thread = workerThread;
    return thread != null && thread.isAlive();
  }

  /**
   * The number of items this worker has executed, including ones it ran while helping.
   */
  public int getWorkItemCount() {
    return workItemCount.get();
  }

  /**
   * What killed this worker, or {@code null} if it is running or stopped normally.
   */
  @Nullable
  public Throwable getFailure() {
    return failure;
  }

  @Nullable
  public WorkItem getCurrentWorkItem() {
    synchronized (cancelLock) {
      return currentWorkItem;
    }
  }

  /**
   * Creates the worker thread and starts processing work items.
   */
  public synchronized void start() {
    Preconditions.checkState(workerThread == null, "%s has already been started", name);
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat(name.replace("%", "%%"))
        .build();
    running = true;
    Thread thread = threadFactory.newThread(new Runnable() {
      @Override
      public void run() {
        runLoop();
      }
    });
    workerThread = thread;
    logger.info(String.format("%s starting on %s", name, workQueue.getName()));
    thread.start();
  }

  /**
   * Waits up to {@code millis} for the worker thread to exit.
   *
   * @return {@code true} if the thread has exited or was never started.
   */
  public boolean join(long millis) throws InterruptedException {
    Thread thread = workerThread;
    if (thread == null) {
      return true;
    }
    thread.join(millis);
    return !thread.isAlive();
  }

  private void runLoop() {
    CURRENT.set(this);
    // A Java thread has no apartment to set; its affinity comes from being the only consumer of
    // an apartment queue.
    apartment = workQueue.getTargetApartment();
    try {
      while (running) {
        WorkItem item = workQueue.dequeue();
        if (item == null) {
          break;
        }
        process(item);
      }
    } catch (InterruptedException e) {
      logger.info(name + " interrupted while waiting for work");
    } catch (RuntimeException | Error e) {
      failure = e;
      logger.log(Level.SEVERE, name + " failed outside of test execution", e);
    } finally {
      CURRENT.remove();
      logger.info(String.format("%s stopping - %d WorkItems processed.",
          name, workItemCount.get()));
      try {
        listener.stopped(this, failure);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Listener failed on stop of " + name, e);
      }
    }
  }

  private void process(WorkItem item) {
    WorkItem previous;
    synchronized (cancelLock) {
      previous = currentWorkItem;
      currentWorkItem = item;
    }
    item.setWorkerName(name);
    logger.fine(String.format("%s executing %s", name, item.getName()));

    boolean wasAbandoned;
    try {
      // The listener may install a fresh queue set here, so that what the item enqueues while
      // executing lands in that set rather than in the one it was dequeued from.
      listener.busy(this, item);
      item.execute();
    } finally {
      synchronized (cancelLock) {
        wasAbandoned = abandoned.remove(item);
        currentWorkItem = previous;
      }
    }
    if (!wasAbandoned) {
      listener.idle(this, item);
    }
    workItemCount.incrementAndGet();
  }

  /**
   * Executes {@code item} on the calling worker's thread without queueing it, with the usual busy
   * and idle notifications.
   */
  void runDirect(WorkItem item) {
    Preconditions.checkState(CURRENT.get() == this,
        "%s can only run items directly on its own thread", name);
    try {
      process(item);
    } catch (RuntimeException | Error e) {
      failure = e;
      running = false;
      logger.log(Level.SEVERE, name + " failed outside of test execution", e);
      throw e;
    }
  }

  /**
   * Executes items from this worker's own queue until {@code done} holds. A composite item
   * waiting for its children calls this so that its worker keeps the queue moving instead of
   * sitting blocked on it. Items the listener hands off, such as timed test cases that may have
   * to be abandoned, are waited for rather than run on top of the waiting composite.
   *
   * @throws IllegalStateException If called from any thread but this worker's.
   */
  void helpUntil(BooleanSupplier done) throws InterruptedException {
    Preconditions.checkState(CURRENT.get() == this,
        "%s can only help from its own thread", name);
    while (!done.getAsBoolean()) {
      WorkItem next = null;
      if (running && workQueue.getState() != WorkItemQueueState.STOPPED) {
        next = workQueue.tryDequeue(HELP_POLL_MILLIS, TimeUnit.MILLISECONDS);
      } else {
        Thread.sleep(HELP_POLL_MILLIS);
      }
      if (next != null) {
        try {
          if (listener.handOff(this, next)) {
            awaitHandedOff(next, done);
          } else {
            process(next);
          }
        } catch (RuntimeException | Error e) {
          failure = e;
          running = false;
          logger.log(Level.SEVERE, name + " failed outside of test execution while helping", e);
          throw e;
        }
      }
    }
  }

  // Holds this thread as if it were running the item itself, so the queue it came from gains no
  // concurrency from the hand-off.
  private void awaitHandedOff(WorkItem item, BooleanSupplier done) throws InterruptedException {
    while (running && !done.getAsBoolean()) {
      if (item.awaitCompletion(HELP_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
  }

  /**
   * Stops this worker, either at once or after it finishes its current item.
   *
   * @param force {@code true} to stop the loop and force-cancel the current item, which is then
   *     abandoned without an idle notification; {@code false} to gracefully cancel the current
   *     item and keep going until the queue is stopped.
   */
  public void cancel(boolean force) {
    if (force) {
      running = false;
    }
    synchronized (cancelLock) {
      if (workerThread != null && currentWorkItem != null) {
        currentWorkItem.cancel(force);
        if (force) {
          abandoned.add(currentWorkItem);
          currentWorkItem = null;
        }
      }
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
