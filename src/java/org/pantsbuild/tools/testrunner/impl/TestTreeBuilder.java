// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.junit.Test;
import org.junit.runners.model.FrameworkMethod;
import org.junit.runners.model.InitializationError;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestNode;

/**
 * Builds test trees from JUnit 4 style test classes: one composite per class, holding one leaf per
 * {@literal @Test} method. The leaves and the class's one-time fixture run on JUnit's own
 * statements, see {@link JUnitClassStatements}.
 * <p>
 * How a class is scheduled follows its {@link Concurrency}:
 * <ul>
 *   <li>{@code SERIAL}: the class runs by itself on the serial lane and its methods run in
 *   order.</li>
 *   <li>{@code PARALLEL_CLASSES}: the class runs alongside other classes; its methods run in
 *   order on the class's thread.</li>
 *   <li>{@code PARALLEL_METHODS}: the class is isolated and its methods run in parallel with each
 *   other only.</li>
 *   <li>{@code PARALLEL_CLASSES_AND_METHODS}: the class and its methods all run in the shared
 *   parallel pool.</li>
 * </ul>
 * </p>
 */
public class TestTreeBuilder {
  private final Concurrency defaultConcurrency;

  public TestTreeBuilder(Concurrency defaultConcurrency) {
    this.defaultConcurrency = Preconditions.checkNotNull(defaultConcurrency);
  }

  /**
   * Builds one tree per class, running every test method of each.
   */
  public List<TestNode> build(Class<?>... classes) {
    ImmutableList.Builder<Spec> specs = ImmutableList.builder();
    for (Class<?> clazz : classes) {
      specs.add(new Spec(clazz));
    }
    return build(specs.build());
  }

  List<TestNode> build(Collection<Spec> specs) {
    ImmutableList.Builder<TestNode> roots = ImmutableList.builder();
    for (Spec spec : specs) {
      roots.add(buildClass(spec));
    }
    return roots.build();
  }

  private TestNode buildClass(Spec spec) {
    Class<?> clazz = spec.getSpecClass();
    Concurrency concurrency = spec.getConcurrency(defaultConcurrency);

    TestNode.Builder node = TestNode.composite(clazz.getName())
        .parallelizable(concurrency.shouldRunClassesParallel())
        .isolated(concurrency.shouldIsolateClass())
        .requiredApartment(Util.getRequiredApartment(clazz));
    String ignoreReason = Util.getIgnoreReason(clazz);
    if (ignoreReason != null) {
      node.ignore(ignoreReason);
    }

    JUnitClassStatements statements;
    try {
      statements = new JUnitClassStatements(clazz);
    } catch (InitializationError e) {
      return node.addChild(initializationError(clazz, e.getCauses().get(0))).build();
    } catch (IllegalArgumentException e) {
      // More than one constructor, say.
      return node.addChild(initializationError(clazz, e)).build();
    }

    Set<String> selected = spec.getMethods();
    boolean anyToRun = false;
    for (FrameworkMethod method : statements.getTestMethods()) {
      if (selected.isEmpty() || selected.contains(method.getName())) {
        TestNode leaf = buildMethod(clazz, statements, method, concurrency);
        anyToRun |= !leaf.isIgnored();
        node.addChild(leaf);
      }
    }
    if (anyToRun && ignoreReason == null) {
      node.fixture(statements.classFixture());
    }
    return node.build();
  }

  private TestNode buildMethod(Class<?> clazz, JUnitClassStatements statements,
      FrameworkMethod method, Concurrency concurrency) {

    Test test = method.getAnnotation(Test.class);
    String name = Util.getPantsFriendlyDisplayName(clazz, method.getName());
    TestNode.Builder leaf = TestNode.leaf(name, statements.methodAction(method))
        .parallelizable(concurrency.shouldRunMethodsParallel())
        .timeoutMillis(test.timeout())
        .requiredApartment(Util.getRequiredApartment(method.getMethod()));
    if (statements.isIgnoredMethod(method)) {
      String ignoreReason = Util.getIgnoreReason(method.getMethod());
      leaf.ignore(ignoreReason == null ? "" : ignoreReason);
    }
    return leaf.build();
  }

  // A class JUnit refuses to run reports one error, as JUnit itself does.
  private static TestNode initializationError(Class<?> clazz, final Throwable cause) {
    return TestNode.leaf(Util.getPantsFriendlyDisplayName(clazz, "initializationError"),
        new TestAction() {
          @Override
          public void run(TestContext context) throws Throwable {
            throw cause;
          }
        }).build();
  }
}
