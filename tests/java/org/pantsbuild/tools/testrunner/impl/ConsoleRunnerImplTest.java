// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.pantsbuild.tools.testrunner.execution.ExecutionListener;
import org.pantsbuild.tools.testrunner.lib.AllFailingTest;
import org.pantsbuild.tools.testrunner.lib.AllIgnoredTest;
import org.pantsbuild.tools.testrunner.lib.AnnotatedParallelMethodsTest1;
import org.pantsbuild.tools.testrunner.lib.AnnotatedParallelTest1;
import org.pantsbuild.tools.testrunner.lib.AnnotatedParallelTest2;
import org.pantsbuild.tools.testrunner.lib.ApartmentTest;
import org.pantsbuild.tools.testrunner.lib.FailingBeforeClassTest;
import org.pantsbuild.tools.testrunner.lib.MockTest1;
import org.pantsbuild.tools.testrunner.lib.MockTest2;
import org.pantsbuild.tools.testrunner.lib.TestRegistry;
import org.pantsbuild.tools.testrunner.lib.TimeoutTest;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestAction;
import org.pantsbuild.tools.testrunner.model.TestContext;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestOutput;
import org.pantsbuild.tools.testrunner.model.TestResult;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

/**
 * Runs test classes through a ConsoleRunnerImpl and makes assertions on its output.
 */
public class ConsoleRunnerImplTest {

  @Rule
  public TemporaryFolder temporary = new TemporaryFolder();

  private boolean failFast;
  private boolean perTestTimer;
  private Concurrency defaultConcurrency;
  private int parallelThreads;
  private long timeoutMillis;
  private long cancelGraceMillis;
  private boolean apartmentsSupported;
  private ByteArrayOutputStream errContent;

  @Before
  public void setUp() {
    resetParameters();
    TestRegistry.reset();
    ConsoleRunnerImpl.setCallSystemExitOnFinish(false);
    ConsoleRunnerImpl.addTestListener(null);
  }

  @After
  public void tearDown() {
    ConsoleRunnerImpl.setCallSystemExitOnFinish(true);
    ConsoleRunnerImpl.addTestListener(null);
  }

  private void resetParameters() {
    failFast = false;
    perTestTimer = false;
    defaultConcurrency = Concurrency.SERIAL;
    parallelThreads = 2;
    timeoutMillis = 0;
    cancelGraceMillis = 50;
    apartmentsSupported = true;
    errContent = new ByteArrayOutputStream();
  }

  private String runTestExpectingSuccess(Class<?>... testClasses) {
    return runTests(names(testClasses), false);
  }

  private String runTestExpectingFailure(Class<?>... testClasses) {
    return runTests(names(testClasses), true);
  }

  private static List<String> names(Class<?>... testClasses) {
    List<String> names = Lists.newArrayList();
    for (Class<?> testClass : testClasses) {
      names.add(testClass.getName());
    }
    return names;
  }

  private String runTests(List<String> tests, boolean shouldFail) {
    ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    PrintStream outputStream = new PrintStream(outContent, true);

    ConsoleRunnerImpl runner = new ConsoleRunnerImpl(
        failFast,
        perTestTimer,
        defaultConcurrency,
        parallelThreads,
        timeoutMillis,
        cancelGraceMillis,
        apartmentsSupported,
        outputStream,
        new PrintStream(errContent, true));

    try {
      runner.run(tests);
      if (shouldFail) {
        fail("Expected RuntimeException.\n====stdout====\n" + outContent.toString());
      }
    } catch (RuntimeException e) {
      boolean wasNormalFailure = e.getMessage() != null
          && e.getMessage().contains("ConsoleRunner exited with status");
      if (!shouldFail || !wasNormalFailure) {
        System.err.println("\n====stdout====\n" + outContent.toString());
        throw e;
      }
    }

    try {
      return outContent.toString(Charsets.UTF_8.toString());
    } catch (UnsupportedEncodingException e) {
      throw new RuntimeException(e);
    }
  }

  @Test
  public void testPassingClasses() {
    String output = runTestExpectingSuccess(MockTest1.class, MockTest2.class);
    assertThat(output, containsString("....."));
    assertThat(output, containsString("OK (5 tests)"));
    assertEquals("test11 test12 test13 test21 test22", TestRegistry.getCalledTests());
  }

  @Test
  public void testFailures() {
    String output = runTestExpectingFailure(AllFailingTest.class);
    assertThat(output, containsString("There were 4 failures:"));
    assertThat(output, containsString(
        "1) org.pantsbuild.tools.testrunner.lib.AllFailingTest#test1"));
    assertThat(output, containsString("FAILURES!!!"));
    assertThat(output, containsString(
        "Tests run: 4,  Failures: 4,  Errors: 0,  Skipped: 0,  Cancelled: 0"));
  }

  @Test
  public void testFailFast() {
    failFast = true;
    String output = runTestExpectingFailure(AllFailingTest.class);
    assertThat(output, containsString("There was 1 failure:"));
    assertThat(output, containsString(
        "Tests run: 4,  Failures: 1,  Errors: 0,  Skipped: 0,  Cancelled: 3"));
  }

  @Test
  public void testIgnoredClass() {
    String output = runTestExpectingSuccess(AllIgnoredTest.class);
    assertThat(output, containsString("OK (1 test)"));
    assertEquals("", TestRegistry.getCalledTests());
  }

  @Test
  public void testPerTestTimer() {
    perTestTimer = true;
    String output = runTestExpectingSuccess(MockTest1.class);
    assertThat(output, containsString("org.pantsbuild.tools.testrunner.lib.MockTest1\n"));
    assertThat(output, containsString(
        "\torg.pantsbuild.tools.testrunner.lib.MockTest1#testMethod11 ("));
    assertThat(output, not(containsString("-> FAILED")));
  }

  @Test
  public void testParallelClasses() {
    AnnotatedParallelTest1.reset();
    String output = runTestExpectingSuccess(
        AnnotatedParallelTest1.class, AnnotatedParallelTest2.class);
    assertThat(output, containsString("OK (2 tests)"));
    assertEquals("aptest1 aptest2", TestRegistry.getCalledTests());
  }

  @Test
  public void testParallelMethods() {
    AnnotatedParallelMethodsTest1.reset();
    String output = runTestExpectingSuccess(AnnotatedParallelMethodsTest1.class);
    assertThat(output, containsString("OK (2 tests)"));
  }

  @Test
  public void testApartmentTestsShareAThread() {
    ApartmentTest.THREADS.clear();
    parallelThreads = 4;
    runTestExpectingSuccess(ApartmentTest.class);
    assertEquals(1, ApartmentTest.THREADS.size());
  }

  @Test
  public void testApartmentsCanBeTurnedOff() {
    apartmentsSupported = false;
    String output = runTestExpectingSuccess(ApartmentTest.class);
    assertThat(output, containsString("OK (3 tests)"));
  }

  @Test
  public void testTimeout() {
    String output = runTestExpectingFailure(TimeoutTest.class);
    assertThat(output, containsString("There was 1 failure:"));
    assertThat(output, containsString("Test exceeded timeout value of 100 ms"));
    assertEquals("quick", TestRegistry.getCalledTests());
  }

  @Test
  public void testFailingBeforeClass() {
    String output = runTestExpectingFailure(FailingBeforeClassTest.class);
    assertThat(output, containsString("no database"));
    assertEquals("", TestRegistry.getCalledTests());
  }

  @Test
  public void testBadSpec() {
    runTests(ImmutableList.of("org.pantsbuild.tools.testrunner.lib.NoSuchTest"), true);
    assertThat(errContent.toString(), containsString(
        "Class org.pantsbuild.tools.testrunner.lib.NoSuchTest not found in classpath."));
  }

  @Test
  public void testSingleMethodSpec() {
    String output = runTests(ImmutableList.of(MockTest1.class.getName() + "#testMethod12"), false);
    assertThat(output, containsString("OK (1 test)"));
    assertEquals("test12", TestRegistry.getCalledTests());
  }

  @Test
  public void testTestListenerHook() {
    final AtomicInteger finished = new AtomicInteger();
    ConsoleRunnerImpl.addTestListener(new ExecutionListener() {
      @Override public void testFinished(TestResult result) {
        if (result.getTest().isLeaf()) {
          finished.incrementAndGet();
        }
      }
    });
    runTestExpectingSuccess(MockTest1.class);
    assertEquals(3, finished.get());
  }

  @Test
  public void testArgFile() throws Exception {
    File argFile = temporary.newFile("tests.args");
    Files.asCharSink(argFile, Charsets.UTF_8).write(
        MockTest1.class.getName() + "\n" + MockTest2.class.getName() + "#testMethod21\n");

    ConsoleRunnerImpl.main(new String[] {"-parallel-threads", "1", "@" + argFile.getPath()});

    assertEquals("test11 test12 test13 test21", TestRegistry.getCalledTests());
  }

  @Test
  public void testCountFailures() {
    TestAction pass = new TestAction() {
      @Override public void run(TestContext context) {
      }
    };
    TestNode a = TestNode.leaf("a", pass).build();
    TestNode b = TestNode.leaf("b", pass).build();
    TestNode suite = TestNode.composite("suite").addChild(a).addChild(b).build();
    TestResult result = TestResult.forComposite(suite, ResultState.ERROR, "OneTimeTearDown: x",
        new IllegalStateException("x"),
        ImmutableList.of(
            TestResult.forLeaf(a, ResultState.FAILURE, null, null, Duration.ZERO,
                ImmutableList.<TestOutput>of()),
            TestResult.forLeaf(b, ResultState.CANCELLED, null, null, Duration.ZERO,
                ImmutableList.<TestOutput>of())),
        Duration.ZERO);

    assertEquals(2, ConsoleRunnerImpl.countFailures(ImmutableList.of(result)));
  }
}
