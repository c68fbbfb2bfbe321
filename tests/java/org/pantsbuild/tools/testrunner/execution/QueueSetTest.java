// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;
import org.pantsbuild.tools.testrunner.model.ApartmentState;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestNode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class QueueSetTest {
  private static final TestAction PASS = new TestAction() {
    @Override public void run(TestContext context) {
    }
  };

  private static final WorkItemDispatcher NO_DISPATCH = new WorkItemDispatcher() {
    @Override public void dispatch(WorkItem parent, List<WorkItem> children) {
    }

    @Override public void awaitChildren(WorkItem parent, List<WorkItem> children) {
    }

    @Override public ExecutionListener getListener() {
      return new ExecutionListener() { };
    }
  };

  private static final TestWorkerListener IGNORE_WORKERS = new TestWorkerListener() {
    @Override public void busy(TestWorker worker, WorkItem item) {
    }

    @Override public void idle(TestWorker worker, WorkItem item) {
    }

    @Override public void stopped(TestWorker worker, @Nullable Throwable cause) {
    }

    @Override public boolean handOff(TestWorker worker, WorkItem item) {
      return false;
    }
  };

  /**
   * Hands out workers without starting them so queued items stay put.
   */
  private static class RecordingHost implements QueueSet.Host {
    final List<String> startedOn = Lists.newArrayList();
    int drainedCount;

    @Override
    public TestWorker startWorker(WorkItemQueue queue) {
      startedOn.add(queue.getName());
      return new TestWorker(queue, queue.getName() + "#" + startedOn.size(), IGNORE_WORKERS);
    }

    @Override
    public void drained(QueueSet set) {
      drainedCount++;
    }
  }

  private RecordingHost host;
  private QueueSet set;

  @Before
  public void setUp() {
    host = new RecordingHost();
    set = new QueueSet("Root", null, 3, host);
  }

  private static WorkItem item(String name) {
    return new WorkItem(TestNode.leaf(name, PASS).build(), NO_DISPATCH);
  }

  @Test
  public void testLanesAndWorkersAreCreatedOnFirstUse() {
    assertTrue(set.getQueues().isEmpty());

    set.enqueue(item("p1"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    set.enqueue(item("p2"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    assertEquals(Lists.newArrayList("Root.Parallel", "Root.Parallel", "Root.Parallel"),
        host.startedOn);

    set.enqueue(item("n1"), QueueSet.Lane.NON_PARALLEL, ApartmentState.UNKNOWN);
    set.enqueue(item("s1"), QueueSet.Lane.APARTMENT, ApartmentState.STA);
    set.enqueue(item("s2"), QueueSet.Lane.APARTMENT, ApartmentState.STA);

    assertEquals(5, host.startedOn.size());
    assertEquals("Root.NonParallel", host.startedOn.get(3));
    assertEquals("Root.STA", host.startedOn.get(4));
    assertEquals(ApartmentState.STA, set.getQueues().get(2).getTargetApartment());
    assertEquals(5, set.getWorkers().size());
    assertEquals(5, set.getOutstanding());
    assertFalse(set.isDrained());
  }

  @Test
  public void testDrainedWhenOutstandingReachesZero() {
    WorkItem a = item("a");
    WorkItem b = item("b");
    set.enqueue(a, QueueSet.Lane.NON_PARALLEL, ApartmentState.UNKNOWN);
    set.enqueue(b, QueueSet.Lane.NON_PARALLEL, ApartmentState.UNKNOWN);
    WorkItemQueue queue = set.getQueues().get(0);
    queue.drainRemaining();

    set.itemCompleted();
    assertEquals(0, host.drainedCount);
    set.itemCompleted();
    assertEquals(1, host.drainedCount);
    assertTrue(set.isDrained());
  }

  @Test
  public void testHandOffLaneMirrorsItsSourceLane() {
    WorkItem p = item("p");
    WorkItem timed = item("timed");
    set.enqueue(p, QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    set.enqueue(timed, QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    WorkItemQueue parallel = set.getQueues().get(0);
    assertEquals(2, set.getOutstanding());

    set.handOff(timed, parallel);
    assertEquals(2, set.getOutstanding());
    assertEquals(6, host.startedOn.size());
    assertEquals("Root.ParallelHandOff", host.startedOn.get(3));
    assertEquals(2, set.getQueues().size());
    WorkItemQueue handOff = set.getQueues().get(1);
    assertEquals(1, handOff.size());

    // A second hand-off reuses the lane and its workers.
    set.handOff(item("again"), parallel);
    assertEquals(6, host.startedOn.size());
    assertEquals(2, handOff.size());

    set.enqueue(item("n"), QueueSet.Lane.NON_PARALLEL, ApartmentState.UNKNOWN);
    set.enqueue(item("s"), QueueSet.Lane.APARTMENT, ApartmentState.STA);
    WorkItemQueue sta = set.getQueues().get(2);
    set.handOff(item("timedSta"), sta);
    assertEquals("Root.STAHandOff", host.startedOn.get(host.startedOn.size() - 1));
    assertEquals(9, host.startedOn.size());
    assertEquals(ApartmentState.STA,
        set.getQueues().get(set.getQueues().size() - 1).getTargetApartment());
  }

  @Test
  public void testHandOffLaneFollowsPause() {
    set.enqueue(item("p"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    set.pause();
    set.handOff(item("timed"), set.getQueues().get(0));
    WorkItemQueue handOff = set.getQueues().get(1);
    assertEquals(WorkItemQueueState.PAUSED, handOff.getState());

    set.resume();
    assertEquals(WorkItemQueueState.OPEN, handOff.getState());
  }

  @Test(expected = IllegalStateException.class)
  public void testHandOffIntoStoppedSetFails() {
    set.enqueue(item("p"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    WorkItemQueue parallel = set.getQueues().get(0);
    set.stop();
    set.handOff(item("timed"), parallel);
  }

  @Test(expected = IllegalStateException.class)
  public void testCompletingMoreThanQueuedFails() {
    set.itemCompleted();
  }

  @Test
  public void testPauseCoversLanesCreatedLater() {
    set.enqueue(item("p"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    set.pause();
    set.enqueue(item("n"), QueueSet.Lane.NON_PARALLEL, ApartmentState.UNKNOWN);

    for (WorkItemQueue queue : set.getQueues()) {
      assertEquals(WorkItemQueueState.PAUSED, queue.getState());
    }
    set.resume();
    for (WorkItemQueue queue : set.getQueues()) {
      assertEquals(WorkItemQueueState.OPEN, queue.getState());
    }
  }

  @Test
  public void testStopRejectsNewWork() {
    set.enqueue(item("p"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
    set.stop();
    set.stop();
    assertEquals(WorkItemQueueState.STOPPED, set.getState());
    assertEquals(WorkItemQueueState.STOPPED, set.getQueues().get(0).getState());
    try {
      set.enqueue(item("late"), QueueSet.Lane.PARALLEL, ApartmentState.UNKNOWN);
      throw new AssertionError("Expected a stopped set to reject work");
    } catch (IllegalStateException expected) {
      // expected
    }
    assertEquals(1, set.getOutstanding());
  }
}
