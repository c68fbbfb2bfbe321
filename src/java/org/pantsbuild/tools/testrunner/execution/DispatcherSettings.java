// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.execution;

import com.google.common.base.Preconditions;

/**
 * Tuning for a {@link Dispatcher}. Instances are immutable; start from {@link #builder()}.
 */
public final class DispatcherSettings {
  public static final long DEFAULT_CANCEL_GRACE_PERIOD_MILLIS = 1000;
  public static final long DEFAULT_WORKER_JOIN_MILLIS = 5000;

  private final int levelOfParallelism;
  private final boolean apartmentsSupported;
  private final long defaultTimeoutMillis;
  private final long cancelGracePeriodMillis;
  private final long workerJoinMillis;
  private final boolean replaceAbandonedWorkers;

  private DispatcherSettings(Builder builder) {
    this.levelOfParallelism = builder.levelOfParallelism;
    this.apartmentsSupported = builder.apartmentsSupported;
    this.defaultTimeoutMillis = builder.defaultTimeoutMillis;
    this.cancelGracePeriodMillis = builder.cancelGracePeriodMillis;
    this.workerJoinMillis = builder.workerJoinMillis;
    this.replaceAbandonedWorkers = builder.replaceAbandonedWorkers;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The settings a dispatcher uses when given none: one worker per available processor.
   */
  public static DispatcherSettings defaults() {
    return builder().build();
  }

  static int availableProcessors() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  /**
   * The most workers a queue set runs on its parallel lane.
   */
  public int getLevelOfParallelism() {
    return levelOfParallelism;
  }

  public boolean isApartmentsSupported() {
    return apartmentsSupported;
  }

  /**
   * The timeout applied to test cases that declare none, or 0 for no limit.
   */
  public long getDefaultTimeoutMillis() {
    return defaultTimeoutMillis;
  }

  /**
   * How long a timed-out test case is given to notice a cancel request before it is aborted.
   */
  public long getCancelGracePeriodMillis() {
    return cancelGracePeriodMillis;
  }

  public long getWorkerJoinMillis() {
    return workerJoinMillis;
  }

  public boolean isReplaceAbandonedWorkers() {
    return replaceAbandonedWorkers;
  }

  public Builder toBuilder() {
    return new Builder()
        .setLevelOfParallelism(levelOfParallelism)
        .setApartmentsSupported(apartmentsSupported)
        .setDefaultTimeoutMillis(defaultTimeoutMillis)
        .setCancelGracePeriodMillis(cancelGracePeriodMillis)
        .setWorkerJoinMillis(workerJoinMillis)
        .setReplaceAbandonedWorkers(replaceAbandonedWorkers);
  }

  @Override
  public String toString() {
    return String.format("DispatcherSettings{parallelism=%d, apartments=%s, timeout=%dms,"
        + " grace=%dms, join=%dms, replaceWorkers=%s}",
        levelOfParallelism, apartmentsSupported, defaultTimeoutMillis, cancelGracePeriodMillis,
        workerJoinMillis, replaceAbandonedWorkers);
  }

  public static final class Builder {
    private int levelOfParallelism = availableProcessors();
    private boolean apartmentsSupported = true;
    private long defaultTimeoutMillis;
    private long cancelGracePeriodMillis = DEFAULT_CANCEL_GRACE_PERIOD_MILLIS;
    private long workerJoinMillis = DEFAULT_WORKER_JOIN_MILLIS;
    private boolean replaceAbandonedWorkers = true;

    private Builder() {
    }

    /**
     * @param levelOfParallelism The number of parallel workers per queue set; 0 picks one per
     *     available processor.
     */
    public Builder setLevelOfParallelism(int levelOfParallelism) {
      Preconditions.checkArgument(levelOfParallelism >= 0,
          "The level of parallelism cannot be negative: %s", levelOfParallelism);
      this.levelOfParallelism =
          levelOfParallelism == 0 ? availableProcessors() : levelOfParallelism;
      return this;
    }

    public Builder setApartmentsSupported(boolean apartmentsSupported) {
      this.apartmentsSupported = apartmentsSupported;
      return this;
    }

    public Builder setDefaultTimeoutMillis(long defaultTimeoutMillis) {
      Preconditions.checkArgument(defaultTimeoutMillis >= 0,
          "The default timeout cannot be negative: %s", defaultTimeoutMillis);
      this.defaultTimeoutMillis = defaultTimeoutMillis;
      return this;
    }

    public Builder setCancelGracePeriodMillis(long cancelGracePeriodMillis) {
      Preconditions.checkArgument(cancelGracePeriodMillis >= 0,
          "The cancel grace period cannot be negative: %s", cancelGracePeriodMillis);
      this.cancelGracePeriodMillis = cancelGracePeriodMillis;
      return this;
    }

    public Builder setWorkerJoinMillis(long workerJoinMillis) {
      Preconditions.checkArgument(workerJoinMillis >= 0,
          "The worker join time cannot be negative: %s", workerJoinMillis);
      this.workerJoinMillis = workerJoinMillis;
      return this;
    }

    public Builder setReplaceAbandonedWorkers(boolean replaceAbandonedWorkers) {
      this.replaceAbandonedWorkers = replaceAbandonedWorkers;
      return this;
    }

    public DispatcherSettings build() {
      return new DispatcherSettings(this);
    }
  }
}
