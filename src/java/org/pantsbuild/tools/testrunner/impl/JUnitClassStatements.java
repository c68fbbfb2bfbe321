// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.rules.RunRules;
import org.junit.rules.TestRule;
import org.junit.runners.BlockJUnit4ClassRunner;
import org.junit.runners.model.FrameworkMethod;
import org.junit.runners.model.InitializationError;
import org.junit.runners.model.Statement;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestFixture;

/**
 * Borrows JUnit's own statements for a test class without letting JUnit run it: each test method
 * becomes a {@link TestAction} built from {@link #methodBlock(FrameworkMethod)}, with its
 * {@literal @Before}, {@literal @After}, rules and expected exceptions, and the class's
 * {@literal @BeforeClass}, {@literal @AfterClass} and class rules become a {@link TestFixture}
 * around the class's children.
 */
class JUnitClassStatements extends BlockJUnit4ClassRunner {

  static final Comparator<FrameworkMethod> BY_NAME = new Comparator<FrameworkMethod>() {
    @Override public int compare(FrameworkMethod a, FrameworkMethod b) {
      return a.getName().compareTo(b.getName());
    }
  };

  JUnitClassStatements(Class<?> clazz) throws InitializationError {
    super(clazz);
  }

  /**
   * The test methods of the class, sorted by name so that runs are repeatable.
   */
  List<FrameworkMethod> getTestMethods() {
    List<FrameworkMethod> methods = Lists.newArrayList(getChildren());
    methods.sort(BY_NAME);
    return ImmutableList.copyOf(methods);
  }

  boolean isIgnoredMethod(FrameworkMethod method) {
    return isIgnored(method);
  }

  /**
   * Runs {@code method} on a fresh instance of the class.
   */
  TestAction methodAction(final FrameworkMethod method) {
    return new TestAction() {
      @Override
      public void run(TestContext context) throws Throwable {
        methodBlock(method).evaluate();
      }
    };
  }

  /**
   * Runs the class's one-time fixtures and class rules around its children.
   */
  TestFixture classFixture() {
    return new TestFixture() {
      @Override
      public void run(final TestContext context, final TestAction children) throws Throwable {
        Statement statement = new Statement() {
          @Override
          public void evaluate() throws Throwable {
            children.run(context);
          }
        };
        statement = withBeforeClasses(statement);
        statement = withAfterClasses(statement);
        List<TestRule> classRules = classRules();
        if (!classRules.isEmpty()) {
          statement = new RunRules(statement, classRules, getDescription());
        }
        statement.evaluate();
      }
    };
  }

  /**
   * Leaves timeouts to the dispatcher, which reads them off {@literal @Test} itself.
   */
  @Override
  @SuppressWarnings("deprecation")
  protected Statement withPotentialTimeout(FrameworkMethod method, Object test, Statement next) {
    return next;
  }
}
