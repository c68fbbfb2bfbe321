// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.pantsbuild.tools.testrunner.model.ApartmentState;

/**
 * The queues that one scope of a run enqueues into: a parallel lane, a single-worker
 * non-parallel lane and one single-worker lane per apartment. Lanes, and the workers consuming
 * them, are created on first use.
 * <P>
 * Each lane may also get a hand-off lane, with as many workers and the same apartment, for items
 * a helping worker must not run on its own stack. Workers of a hand-off lane only ever run test
 * cases, so none of them is ever in the middle of a suite.
 * </P>
 * <P>
 * The set counts the items enqueued into it that have not yet completed. A composite completes only
 * after its children do, so a count of zero means nothing started from this set is still running.
 * </P>
 */
final class QueueSet {

  /**
   * Supplies the workers for a set's lanes and hears when a set runs dry.
   */
  interface Host {
    /**
     * Creates, registers and starts a worker consuming {@code queue}.
     */
    TestWorker startWorker(WorkItemQueue queue);

    /**
     * Called, outside of any set lock, each time the outstanding count of {@code set} reaches
     * zero.
     */
    void drained(QueueSet set);
  }

  enum Lane {
    PARALLEL("Parallel"),
    NON_PARALLEL("NonParallel"),
    APARTMENT("Apartment");

    private final String label;

    Lane(String label) {
      this.label = label;
    }
  }

  private final String name;
  @Nullable private final WorkItem owner;
  private final int parallelWorkers;
  private final Host host;
  private final AtomicInteger outstanding = new AtomicInteger();

  // All guarded by this.
  @Nullable private WorkItemQueue parallelQueue;
  @Nullable private WorkItemQueue nonParallelQueue;
  private final Map<ApartmentState, WorkItemQueue> apartmentQueues =
      new EnumMap<ApartmentState, WorkItemQueue>(ApartmentState.class);
  private final Map<WorkItemQueue, WorkItemQueue> handOffQueues = Maps.newLinkedHashMap();
  private final List<TestWorker> workers = Lists.newArrayList();
  private WorkItemQueueState state = WorkItemQueueState.OPEN;

  /**
   * @param name A name for the set, used to name its queues.
   * @param owner The item whose isolation boundary this set serves, or {@code null} for the set
   *     holding the roots of a run.
   * @param parallelWorkers The number of workers for the parallel lane.
   * @param host Supplies workers and receives drain notifications.
   */
  QueueSet(String name, @Nullable WorkItem owner, int parallelWorkers, Host host) {
    Preconditions.checkArgument(parallelWorkers > 0,
        "A queue set needs at least one parallel worker, given %s", parallelWorkers);
    this.name = Preconditions.checkNotNull(name);
    this.owner = owner;
    this.parallelWorkers = parallelWorkers;
    this.host = Preconditions.checkNotNull(host);
  }

  String getName() {
    return name;
  }

  @Nullable
  WorkItem getOwner() {
    return owner;
  }

  int getParallelWorkers() {
    return parallelWorkers;
  }

  int getOutstanding() {
    return outstanding.get();
  }

  synchronized WorkItemQueueState getState() {
    return state;
  }

  synchronized List<WorkItemQueue> getQueues() {
    ImmutableList.Builder<WorkItemQueue> queues = ImmutableList.builder();
    if (parallelQueue != null) {
      queues.add(parallelQueue);
    }
    if (nonParallelQueue != null) {
      queues.add(nonParallelQueue);
    }
    queues.addAll(apartmentQueues.values());
    queues.addAll(handOffQueues.values());
    return queues.build();
  }

  synchronized List<TestWorker> getWorkers() {
    return ImmutableList.copyOf(workers);
  }

  /**
   * Returns {@code true} once everything enqueued here has completed and left its queue.
   */
  boolean isDrained() {
    if (outstanding.get() != 0) {
      return false;
    }
    for (WorkItemQueue queue : getQueues()) {
      if (!queue.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Enqueues {@code item} on the given lane, starting the lane's workers if this is its first
   * item.
   *
   * @param apartment The apartment of an {@link Lane#APARTMENT} lane; ignored for other lanes.
   * @throws IllegalStateException If the set has been stopped.
   */
  void enqueue(WorkItem item, Lane lane, ApartmentState apartment) {
    WorkItemQueue queue;
    List<WorkItemQueue> toStart;
    synchronized (this) {
      Preconditions.checkState(state != WorkItemQueueState.STOPPED,
          "Cannot enqueue %s: queue set %s is stopped", item, name);
      toStart = Lists.newArrayList();
      queue = queueFor(lane, apartment, toStart);
      outstanding.incrementAndGet();
      try {
        queue.enqueue(item);
      } catch (RuntimeException e) {
        outstanding.decrementAndGet();
        throw e;
      }
    }
    startWorkers(toStart);
  }

  /**
   * Moves {@code item}, taken from {@code from} and still counted as outstanding here, onto the
   * hand-off lane of {@code from}.
   *
   * @throws IllegalStateException If the set has been stopped.
   */
  void handOff(WorkItem item, WorkItemQueue from) {
    List<WorkItemQueue> toStart = Lists.newArrayList();
    synchronized (this) {
      Preconditions.checkState(state != WorkItemQueueState.STOPPED,
          "Cannot hand off %s: queue set %s is stopped", item, name);
      WorkItemQueue queue = handOffQueues.get(from);
      if (queue == null) {
        queue = newQueue(from.getName() + "HandOff", from.getTargetApartment());
        handOffQueues.put(from, queue);
        toStart.add(queue);
      }
      queue.enqueue(item);
    }
    startWorkers(toStart);
  }

  private void startWorkers(List<WorkItemQueue> newQueues) {
    for (WorkItemQueue newQueue : newQueues) {
      int count = workerCount(newQueue);
      for (int i = 0; i < count; i++) {
        TestWorker worker = host.startWorker(newQueue);
        synchronized (this) {
          workers.add(worker);
        }
      }
    }
  }

  private synchronized int workerCount(WorkItemQueue queue) {
    if (queue == parallelQueue) {
      return parallelWorkers;
    }
    for (Map.Entry<WorkItemQueue, WorkItemQueue> handOff : handOffQueues.entrySet()) {
      if (handOff.getValue() == queue) {
        return workerCount(handOff.getKey());
      }
    }
    return 1;
  }

  // Caller holds the lock.
  private WorkItemQueue queueFor(Lane lane, ApartmentState apartment, List<WorkItemQueue> created) {
    switch (lane) {
      case PARALLEL:
        if (parallelQueue == null) {
          parallelQueue = newQueue(name + "." + lane.label, ApartmentState.UNKNOWN);
          created.add(parallelQueue);
        }
        return parallelQueue;
      case NON_PARALLEL:
        if (nonParallelQueue == null) {
          nonParallelQueue = newQueue(name + "." + lane.label, ApartmentState.UNKNOWN);
          created.add(nonParallelQueue);
        }
        return nonParallelQueue;
      case APARTMENT:
        Preconditions.checkArgument(apartment.isRequirement(),
            "An apartment lane needs an apartment, given %s", apartment);
        WorkItemQueue queue = apartmentQueues.get(apartment);
        if (queue == null) {
          queue = newQueue(name + "." + apartment.name(), apartment);
          apartmentQueues.put(apartment, queue);
          created.add(queue);
        }
        return queue;
      default:
        throw new IllegalArgumentException("Unhandled lane " + lane);
    }
  }

  // Caller holds the lock.
  private WorkItemQueue newQueue(String queueName, ApartmentState apartment) {
    WorkItemQueue queue = new WorkItemQueue(queueName, apartment);
    if (state == WorkItemQueueState.PAUSED) {
      queue.pause();
    }
    return queue;
  }

  /**
   * Records the completion of an item enqueued here.
   */
  void itemCompleted() {
    int remaining = outstanding.decrementAndGet();
    Preconditions.checkState(remaining >= 0, "%s completed more items than it queued", name);
    if (remaining == 0) {
      host.drained(this);
    }
  }

  synchronized void pause() {
    if (state == WorkItemQueueState.OPEN) {
      state = WorkItemQueueState.PAUSED;
      for (WorkItemQueue queue : getQueues()) {
        queue.pause();
      }
    }
  }

  synchronized void resume() {
    if (state == WorkItemQueueState.PAUSED) {
      state = WorkItemQueueState.OPEN;
      for (WorkItemQueue queue : getQueues()) {
        queue.resume();
      }
    }
  }

  /**
   * Stops every queue in the set, which lets its workers exit. Safe to call more than once.
   */
  synchronized void stop() {
    state = WorkItemQueueState.STOPPED;
    for (WorkItemQueue queue : getQueues()) {
      queue.stop();
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
