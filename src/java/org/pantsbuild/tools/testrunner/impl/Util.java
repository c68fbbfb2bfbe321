// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import org.junit.Ignore;
import org.junit.Test;
import org.junit.runners.model.FrameworkMethod;
import org.junit.runners.model.TestClass;
import org.pantsbuild.testrunner.annotations.RequiresApartment;
import org.pantsbuild.tools.testrunner.model.ApartmentState;

/**
 * Utilities for reflecting over JUnit 4 style test classes.
 */
final class Util {

  static final Predicate<Method> IS_ANNOTATED_TEST_METHOD =
      new Predicate<Method>() {
        @Override public boolean apply(Method method) {
          return Modifier.isPublic(method.getModifiers())
              && !Modifier.isStatic(method.getModifiers())
              && method.isAnnotationPresent(Test.class);
        }
      };

  static final Predicate<Constructor<?>> IS_PUBLIC_CONSTRUCTOR =
      new Predicate<Constructor<?>>() {
        @Override public boolean apply(Constructor<?> constructor) {
          return Modifier.isPublic(constructor.getModifiers());
        }
      };

  private Util() {
    // utility
  }

  /**
   * Returns the reason the given class or method is {@literal @Ignore}d, or {@code null} if it is
   * not.
   */
  @Nullable
  static String getIgnoreReason(AnnotatedElement element) {
    Ignore ignore = element.getAnnotation(Ignore.class);
    return ignore == null ? null : ignore.value();
  }

  /**
   * Returns the apartment the given class or method asks for with {@link RequiresApartment}.
   */
  static ApartmentState getRequiredApartment(AnnotatedElement element) {
    RequiresApartment requires = element.getAnnotation(RequiresApartment.class);
    if (requires == null) {
      return ApartmentState.UNKNOWN;
    }
    switch (requires.value()) {
      case STA:
        return ApartmentState.STA;
      case MTA:
        return ApartmentState.MTA;
      default:
        throw new IllegalArgumentException("Unhandled apartment " + requires.value());
    }
  }

  /**
   * Returns a pants-friendly formatted name for a test method.
   *
   * Pants likes test-cases formatted as org.foo.bar.TestClassName#testMethodName
   */
  static String getPantsFriendlyDisplayName(Class<?> clazz, String methodName) {
    return clazz.getName() + "#" + methodName;
  }

  /**
   * Returns the {@literal @Test} methods of {@code clazz}, inherited ones included, sorted by name
   * so that runs are repeatable.
   *
   * @throws IllegalArgumentException If JUnit cannot model the class, as when it has more than one
   *     constructor.
   */
  static List<FrameworkMethod> getTestMethods(Class<?> clazz) {
    List<FrameworkMethod> methods =
        Lists.newArrayList(new TestClass(clazz).getAnnotatedMethods(Test.class));
    methods.sort(JUnitClassStatements.BY_NAME);
    return ImmutableList.copyOf(methods);
  }

  static boolean isTestClass(final Class<?> clazz) {
    // Must be a public concrete class to be a runnable junit Test.
    if (clazz.isInterface()
        || Modifier.isAbstract(clazz.getModifiers())
        || !Modifier.isPublic(clazz.getModifiers())) {
      return false;
    }

    // The class must have some public constructor to be instantiated by the runner being used
    if (!Iterables.any(Arrays.asList(clazz.getConstructors()), IS_PUBLIC_CONSTRUCTOR)) {
      return false;
    }

    return Iterables.any(Arrays.asList(clazz.getMethods()), IS_ANNOTATED_TEST_METHOD);
  }
}
