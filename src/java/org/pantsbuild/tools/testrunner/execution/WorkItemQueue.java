// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.pantsbuild.tools.testrunner.model.ApartmentState;

/**
 * A blocking FIFO of {@link WorkItem WorkItems}, consumed by the {@link TestWorker TestWorkers}
 * bound to it.
 * <P>
 * A paused queue still accepts work but hands none out. A stopped queue hands out {@code null} to
 * every blocked and every later dequeuer, which is how workers learn to exit.
 * </P>
 */
public class WorkItemQueue {
  private static final Logger logger = Logger.getLogger(WorkItemQueue.class.getName());

  private final String name;
  private final ApartmentState targetApartment;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition workAvailableOrStopped = lock.newCondition();
  // Guarded by lock.
  private final Deque<WorkItem> items = new ArrayDeque<WorkItem>();
  private WorkItemQueueState state = WorkItemQueueState.OPEN;
  private int itemsProcessed;
  private int maxDepth;

  public WorkItemQueue(String name) {
    this(name, ApartmentState.UNKNOWN);
  }

  public WorkItemQueue(String name, ApartmentState targetApartment) {
    this.name = Preconditions.checkNotNull(name);
    this.targetApartment = Preconditions.checkNotNull(targetApartment);
  }

  public String getName() {
    return name;
  }

  /**
   * The apartment a worker consuming this queue runs in.
   */
  public ApartmentState getTargetApartment() {
    return targetApartment;
  }

  public WorkItemQueueState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * The number of items handed out so far.
   */
  public int getItemsProcessed() {
    lock.lock();
    try {
      return itemsProcessed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * The most items this queue has held at once.
   */
  public int getMaxDepth() {
    lock.lock();
    try {
      return maxDepth;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends {@code item} to the tail of the queue.
   *
   * @throws IllegalStateException If the queue is stopped, or the item is already in a queue.
   */
  public void enqueue(WorkItem item) {
    Preconditions.checkNotNull(item);
    lock.lock();
    try {
      Preconditions.checkState(state != WorkItemQueueState.STOPPED,
          "Cannot enqueue %s: queue %s is stopped", item, name);
      Preconditions.checkState(item.markQueued(), "%s is already in a queue", item);
      items.addLast(item);
      maxDepth = Math.max(maxDepth, items.size());
      if (state == WorkItemQueueState.OPEN) {
        workAvailableOrStopped.signal();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the head of the queue, waiting for one if necessary.
   *
   * @return The next item, or {@code null} once the queue is stopped.
   * @throws InterruptedException If the calling thread is interrupted while waiting.
   */
  @Nullable
  public WorkItem dequeue() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        if (state == WorkItemQueueState.STOPPED) {
          return null;
        }
        if (state == WorkItemQueueState.OPEN && !items.isEmpty()) {
          return takeHead();
        }
        workAvailableOrStopped.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Like {@link #dequeue()}, but gives up after {@code timeout}.
   *
   * @return The next item, or {@code null} if the queue is stopped or nothing became available in
   *     time.
   */
  @Nullable
  public WorkItem tryDequeue(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    lock.lock();
    try {
      while (true) {
        if (state == WorkItemQueueState.STOPPED) {
          return null;
        }
        if (state == WorkItemQueueState.OPEN && !items.isEmpty()) {
          return takeHead();
        }
        if (remainingNanos <= 0) {
          return null;
        }
        remainingNanos = workAvailableOrStopped.awaitNanos(remainingNanos);
      }
    } finally {
      lock.unlock();
    }
  }

  private WorkItem takeHead() {
    WorkItem item = items.removeFirst();
    item.markDequeued();
    itemsProcessed++;
    if (!items.isEmpty()) {
      // Pass the wakeup on; signal() may have been consumed by a thread that found nothing.
      workAvailableOrStopped.signal();
    }
    return item;
  }

  /**
   * Removes {@code item} if it is still waiting in this queue.
   *
   * @return {@code true} if the item was removed.
   */
  public boolean remove(WorkItem item) {
    lock.lock();
    try {
      boolean removed = items.removeFirstOccurrence(item);
      if (removed) {
        item.markDequeued();
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns everything still waiting in the queue.
   */
  public List<WorkItem> drainRemaining() {
    lock.lock();
    try {
      List<WorkItem> drained = ImmutableList.copyOf(items);
      items.clear();
      for (WorkItem item : drained) {
        item.markDequeued();
      }
      return drained;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops handing out work until {@link #resume()} is called. Has no effect on a stopped queue.
   */
  public void pause() {
    lock.lock();
    try {
      if (state == WorkItemQueueState.OPEN) {
        state = WorkItemQueueState.PAUSED;
        logger.fine(name + " paused");
      }
    } finally {
      lock.unlock();
    }
  }

  public void resume() {
    lock.lock();
    try {
      if (state == WorkItemQueueState.PAUSED) {
        state = WorkItemQueueState.OPEN;
        workAvailableOrStopped.signalAll();
        logger.fine(name + " resumed");
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the queue for good and wakes every blocked dequeuer. Safe to call more than once.
   */
  public void stop() {
    lock.lock();
    try {
      if (state != WorkItemQueueState.STOPPED) {
        state = WorkItemQueueState.STOPPED;
        workAvailableOrStopped.signalAll();
        logger.fine(name + " stopped after handing out " + itemsProcessed + " items");
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
