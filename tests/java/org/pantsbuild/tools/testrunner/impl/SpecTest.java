// Copyright 2016 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;
import org.pantsbuild.tools.testrunner.lib.AnnotatedParallelMethodsTest1;
import org.pantsbuild.tools.testrunner.lib.AnnotatedParallelTest1;
import org.pantsbuild.tools.testrunner.lib.ApartmentTest;
import org.pantsbuild.tools.testrunner.lib.MockTest2;
import org.pantsbuild.tools.testrunner.lib.UnannotatedTestClass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpecTest {

  @Test
  public void testWithMethod() {
    Spec spec = new Spec(UnannotatedTestClass.class);
    assertTrue(spec.getMethods().isEmpty());
    assertEquals(UnannotatedTestClass.class.getName(), spec.getSpecName());

    Spec narrowed = spec.withMethod("testMethod").withMethod("otherTestMethod");
    assertEquals(ImmutableSet.of("testMethod", "otherTestMethod"), narrowed.getMethods());
    assertTrue(spec.getMethods().isEmpty());
  }

  @Test
  public void testAnnotationsOverrideDefault() {
    assertEquals(Concurrency.SERIAL,
        new Spec(MockTest2.class).getConcurrency(Concurrency.PARALLEL_CLASSES_AND_METHODS));
    assertEquals(Concurrency.PARALLEL_CLASSES,
        new Spec(AnnotatedParallelTest1.class).getConcurrency(Concurrency.SERIAL));
    assertEquals(Concurrency.PARALLEL_METHODS,
        new Spec(AnnotatedParallelMethodsTest1.class).getConcurrency(Concurrency.SERIAL));
    assertEquals(Concurrency.PARALLEL_CLASSES_AND_METHODS,
        new Spec(ApartmentTest.class).getConcurrency(Concurrency.SERIAL));
  }

  @Test
  public void testDefaultConcurrency() {
    Spec spec = new Spec(UnannotatedTestClass.class);
    assertEquals(Concurrency.SERIAL, spec.getConcurrency(Concurrency.SERIAL));
    assertEquals(Concurrency.PARALLEL_METHODS, spec.getConcurrency(Concurrency.PARALLEL_METHODS));
  }
}
