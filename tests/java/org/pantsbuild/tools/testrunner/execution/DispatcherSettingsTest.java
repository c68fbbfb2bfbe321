// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DispatcherSettingsTest {

  @Test
  public void testDefaults() {
    DispatcherSettings settings = DispatcherSettings.defaults();
    assertEquals(Runtime.getRuntime().availableProcessors(), settings.getLevelOfParallelism());
    assertTrue(settings.isApartmentsSupported());
    assertEquals(0, settings.getDefaultTimeoutMillis());
    assertEquals(DispatcherSettings.DEFAULT_CANCEL_GRACE_PERIOD_MILLIS,
        settings.getCancelGracePeriodMillis());
    assertEquals(DispatcherSettings.DEFAULT_WORKER_JOIN_MILLIS, settings.getWorkerJoinMillis());
    assertTrue(settings.isReplaceAbandonedWorkers());
  }

  @Test
  public void testZeroParallelismMeansOnePerProcessor() {
    DispatcherSettings settings = DispatcherSettings.builder().setLevelOfParallelism(0).build();
    assertEquals(Runtime.getRuntime().availableProcessors(), settings.getLevelOfParallelism());
  }

  @Test
  public void testToBuilderCopies() {
    DispatcherSettings settings = DispatcherSettings.builder()
        .setLevelOfParallelism(3)
        .setApartmentsSupported(false)
        .setDefaultTimeoutMillis(250)
        .build();
    DispatcherSettings copy = settings.toBuilder().setReplaceAbandonedWorkers(false).build();

    assertEquals(3, copy.getLevelOfParallelism());
    assertFalse(copy.isApartmentsSupported());
    assertEquals(250, copy.getDefaultTimeoutMillis());
    assertFalse(copy.isReplaceAbandonedWorkers());
    assertTrue(settings.isReplaceAbandonedWorkers());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeParallelism() {
    DispatcherSettings.builder().setLevelOfParallelism(-1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTimeout() {
    DispatcherSettings.builder().setDefaultTimeoutMillis(-5);
  }
}
