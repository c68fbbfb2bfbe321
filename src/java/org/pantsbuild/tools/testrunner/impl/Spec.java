// Copyright 2016 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.pantsbuild.testrunner.annotations.TestParallel;
import org.pantsbuild.testrunner.annotations.TestParallelClassesAndMethods;
import org.pantsbuild.testrunner.annotations.TestParallelMethods;
import org.pantsbuild.testrunner.annotations.TestSerial;

/**
 * A test class named on the command line, optionally narrowed to some of its methods.
 */
class Spec {
  private final Class<?> clazz;
  private final ImmutableSet<String> methods;

  Spec(Class<?> clazz) {
    this(clazz, ImmutableSet.<String>of());
  }

  private Spec(Class<?> clazz, ImmutableSet<String> methods) {
    this.clazz = Preconditions.checkNotNull(clazz);
    this.methods = Preconditions.checkNotNull(methods);
  }

  String getSpecName() {
    return clazz.getName();
  }

  Class<?> getSpecClass() {
    return clazz;
  }

  /**
   * The methods to run, or an empty set to run the whole class.
   */
  Set<String> getMethods() {
    return methods;
  }

  /**
   * Return a copy of this class spec, but with an additional method.
   */
  Spec withMethod(String method) {
    return new Spec(clazz, ImmutableSet.<String>builder().addAll(methods).add(method).build());
  }

  /**
   * @return either the Concurrency value specified by the class annotation or the default
   * concurrency setting passed in the parameter.
   */
  Concurrency getConcurrency(Concurrency defaultConcurrency) {
    if (clazz.isAnnotationPresent(TestSerial.class)) {
      return Concurrency.SERIAL;
    } else if (clazz.isAnnotationPresent(TestParallel.class)) {
      return Concurrency.PARALLEL_CLASSES;
    } else if (clazz.isAnnotationPresent(TestParallelMethods.class)) {
      return Concurrency.PARALLEL_METHODS;
    } else if (clazz.isAnnotationPresent(TestParallelClassesAndMethods.class)) {
      return Concurrency.PARALLEL_CLASSES_AND_METHODS;
    }
    return defaultConcurrency;
  }

  @Override
  public String toString() {
    return methods.isEmpty() ? clazz.getName() : clazz.getName() + methods;
  }
}
