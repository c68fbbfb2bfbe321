// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import java.util.Set;

import com.google.common.collect.Sets;

import org.junit.Test;
import org.pantsbuild.testrunner.annotations.RequiresApartment;
import org.pantsbuild.testrunner.annotations.TestParallelClassesAndMethods;

/**
 * Records the threads its apartment tests run on. Run by the console runner tests.
 */
@TestParallelClassesAndMethods
public class ApartmentTest {
  public static final Set<String> THREADS = Sets.newConcurrentHashSet();

  @RequiresApartment(RequiresApartment.Kind.STA)
  @Test
  public void testSta1() {
    THREADS.add(Thread.currentThread().getName());
  }

  @RequiresApartment(RequiresApartment.Kind.STA)
  @Test
  public void testSta2() {
    THREADS.add(Thread.currentThread().getName());
  }

  @RequiresApartment(RequiresApartment.Kind.STA)
  @Test
  public void testSta3() {
    THREADS.add(Thread.currentThread().getName());
  }
}
