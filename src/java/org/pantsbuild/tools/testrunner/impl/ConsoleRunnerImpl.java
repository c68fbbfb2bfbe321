// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.StringArrayOptionHandler;
import org.pantsbuild.tools.testrunner.args4j.InvalidCmdLineArgumentException;
import org.pantsbuild.tools.testrunner.execution.Dispatcher;
import org.pantsbuild.tools.testrunner.execution.DispatcherSettings;
import org.pantsbuild.tools.testrunner.execution.ExecutionListener;
import org.pantsbuild.tools.testrunner.execution.RunAbortedException;
import org.pantsbuild.tools.testrunner.model.ResultState;
import org.pantsbuild.tools.testrunner.model.TestNode;
import org.pantsbuild.tools.testrunner.model.TestResult;

/**
 * Runs JUnit 4 style test classes on a {@link Dispatcher}, reporting to the console and exiting
 * with the number of failed tests.
 */
public class ConsoleRunnerImpl {
  /** Should be set to false for unit testing via {@link #setCallSystemExitOnFinish} */
  private static boolean callSystemExitOnFinish = true;
  /** Intended to be used in unit testing this class */
  private static ExecutionListener testListener = null;

  private final boolean failFast;
  private final boolean perTestTimer;
  private final Concurrency defaultConcurrency;
  private final int parallelThreads;
  private final long timeoutMillis;
  private final long cancelGraceMillis;
  private final boolean apartmentsSupported;
  private final PrintStream out;
  private final PrintStream err;

  ConsoleRunnerImpl(
      boolean failFast,
      boolean perTestTimer,
      Concurrency defaultConcurrency,
      int parallelThreads,
      long timeoutMillis,
      long cancelGraceMillis,
      boolean apartmentsSupported,
      PrintStream out,
      PrintStream err) {

    Preconditions.checkNotNull(defaultConcurrency);
    Preconditions.checkArgument(parallelThreads >= 0, "parallelThreads cannot be negative");

    this.failFast = failFast;
    this.perTestTimer = perTestTimer;
    this.defaultConcurrency = defaultConcurrency;
    this.parallelThreads = parallelThreads;
    this.timeoutMillis = timeoutMillis;
    this.cancelGraceMillis = cancelGraceMillis;
    this.apartmentsSupported = apartmentsSupported;
    this.out = Preconditions.checkNotNull(out);
    this.err = Preconditions.checkNotNull(err);
  }

  void run(Collection<String> tests) {
    List<TestNode> roots;
    try {
      roots = new TestTreeBuilder(defaultConcurrency).build(new SpecParser(tests).parse());
    } catch (SpecException e) {
      err.println("Error parsing specs: " + e.getMessage());
      exit(1);
      return;
    }

    DispatcherSettings settings = DispatcherSettings.builder()
        .setLevelOfParallelism(parallelThreads)
        .setApartmentsSupported(apartmentsSupported)
        .setDefaultTimeoutMillis(timeoutMillis)
        .setCancelGracePeriodMillis(cancelGraceMillis)
        .build();
    Dispatcher dispatcher = new Dispatcher(settings);

    if (testListener != null) {
      dispatcher.addListener(testListener);
    }
    if (perTestTimer) {
      dispatcher.addListener(new PerTestConsoleListener(out));
    } else {
      dispatcher.addListener(new ConsoleListener(out));
    }
    if (failFast) {
      dispatcher.addListener(new FailFastListener(dispatcher));
    }

    ShutdownListener shutdownListener = new ShutdownListener(out);
    dispatcher.addListener(shutdownListener);
    // Wrap test execution with registration of a shutdown hook that will ensure we
    // never exit silently if the VM does.
    final Thread unexpectedExitHook = createUnexpectedExitHook(shutdownListener, out);
    Runtime.getRuntime().addShutdownHook(unexpectedExitHook);

    int failures;
    try {
      failures = countFailures(dispatcher.run(roots));
    } catch (RunAbortedException e) {
      err.println(e.getMessage());
      e.printStackTrace(err);
      failures = Math.max(1, countFailures(e.getPartialResults()));
    } finally {
      // If we're exiting via a thrown exception, we'll get a better message by letting it
      // propagate than by halt()ing.
      Runtime.getRuntime().removeShutdownHook(unexpectedExitHook);
    }
    out.flush();
    err.flush();
    exit(failures);
  }

  /**
   * Counts failed test cases plus suites that failed in their own set-up or tear-down.
   */
  @VisibleForTesting
  static int countFailures(List<TestResult> results) {
    int failures = 0;
    for (TestResult result : results) {
      if (result.getTest().isLeaf()) {
        if (result.getState().isFailure()) {
          failures++;
        }
      } else {
        if (result.getState() == ResultState.ERROR && result.getFailure() != null) {
          failures++;
        }
        failures += countFailures(result.getChildren());
      }
    }
    return failures;
  }

  /**
   * Returns a thread that records a system exit to the listener, and then halts(1).
   */
  private Thread createUnexpectedExitHook(final ShutdownListener listener, final PrintStream out) {
    return new Thread() {
      @Override public void run() {
        try {
          listener.unexpectedShutdown();
          // We want to trap and log no matter why abort failed for a better end user message.
        } catch (Exception e) {
          out.println(e);
          e.printStackTrace(out);
        }
        // This error might be a call to `System.exit(0)` in a test, which we definitely do
        // not want to go unnoticed.
        out.println("FATAL: VM exiting unexpectedly.");
        out.flush();
        Runtime.getRuntime().halt(1);
      }
    };
  }

  /**
   * Launcher for the parallel test runner.
   *
   * @param args options from the command line
   */
  public static void main(String[] args) {
    /**
     * Command line option bean.
     */
    class Options {
      @Option(name = "-fail-fast", usage = "Causes the test suite run to fail fast.")
      private boolean failFast;

      @Option(name = "-per-test-timer",
          usage = "Show a description of each test and timer for each test class.")
      private boolean perTestTimer;

      @Option(name = "-default-concurrency",
          usage = "Specify how to parallelize test classes without a concurrency annotation.")
      private Concurrency defaultConcurrency = Concurrency.SERIAL;

      private int parallelThreads = 0;

      @Option(name = "-parallel-threads",
          usage = "Number of threads to execute tests in parallel. Must be positive, "
              + "or 0 to set automatically.")
      public void setParallelThreads(int parallelThreads) {
        if (parallelThreads < 0) {
          throw new InvalidCmdLineArgumentException(
              "-parallel-threads", parallelThreads, "-parallel-threads cannot be negative");
        }
        this.parallelThreads = parallelThreads;
        if (parallelThreads == 0) {
          int availableProcessors = Runtime.getRuntime().availableProcessors();
          this.parallelThreads = availableProcessors;
          System.err.printf("Auto-detected %d processors, using -parallel-threads=%d\n",
              availableProcessors, this.parallelThreads);
        }
      }

      private long timeoutMillis;

      @Option(name = "-timeout-ms",
          usage = "Timeout applied to tests that do not declare their own, 0 for none.")
      public void setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis < 0) {
          throw new InvalidCmdLineArgumentException(
              "-timeout-ms", timeoutMillis, "-timeout-ms cannot be negative");
        }
        this.timeoutMillis = timeoutMillis;
      }

      private long cancelGraceMillis = DispatcherSettings.DEFAULT_CANCEL_GRACE_PERIOD_MILLIS;

      @Option(name = "-cancel-grace-ms",
          usage = "How long a cancelled or timed out test may keep running before it is "
              + "abandoned.")
      public void setCancelGraceMillis(long cancelGraceMillis) {
        if (cancelGraceMillis < 0) {
          throw new InvalidCmdLineArgumentException(
              "-cancel-grace-ms", cancelGraceMillis, "-cancel-grace-ms cannot be negative");
        }
        this.cancelGraceMillis = cancelGraceMillis;
      }

      @Option(name = "-no-apartments",
          usage = "Run tests that require an apartment on the parallel pool instead.")
      private boolean noApartments;

      @Argument(usage = "Names of junit test classes or test methods to run.  Names prefixed "
                        + "with @ are considered arg file paths and these will be loaded and the "
                        + "whitespace delimited arguments found inside added to the list",
                required = true,
                metaVar = "TESTS",
                handler = StringArrayOptionHandler.class)
      private String[] tests = {};
    }

    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
    } catch (InvalidCmdLineArgumentException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
    }

    ConsoleRunnerImpl runner =
        new ConsoleRunnerImpl(options.failFast,
            options.perTestTimer,
            options.defaultConcurrency,
            options.parallelThreads,
            options.timeoutMillis,
            options.cancelGraceMillis,
            !options.noApartments,
            // NB: Buffering helps speedup output-heavy tests.
            new PrintStream(new BufferedOutputStream(System.out), true),
            new PrintStream(new BufferedOutputStream(System.err), true));

    List<String> tests = Lists.newArrayList();
    for (String test : options.tests) {
      if (test.startsWith("@")) {
        try {
          String argFileContents =
              Files.asCharSource(new File(test.substring(1)), Charsets.UTF_8).read();
          tests.addAll(Arrays.asList(argFileContents.trim().split("\\s+")));
        } catch (IOException e) {
          System.err.printf("Failed to load args from arg file %s: %s\n", test, e.getMessage());
          exit(1);
        }
      } else {
        tests.add(test);
      }
    }
    runner.run(tests);
  }

  private static void exit(int code) {
    if (callSystemExitOnFinish) {
      // We're a main - its fine to exit.
      System.exit(code);
    } else {
      if (code != 0) {
        throw new RuntimeException("ConsoleRunner exited with status " + code);
      }
    }
  }

  // ---------------------------- For testing only ---------------------------------

  public static void setCallSystemExitOnFinish(boolean exitOnFinish) {
    callSystemExitOnFinish = exitOnFinish;
  }

  public static void addTestListener(ExecutionListener listener) {
    testListener = listener;
  }
}
