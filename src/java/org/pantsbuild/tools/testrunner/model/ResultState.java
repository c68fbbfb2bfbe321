// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

/**
 * The outcome of running a test or a suite.
 */
public enum ResultState {
  SUCCESS,
  FAILURE,
  ERROR,
  INCONCLUSIVE,
  SKIPPED,
  CANCELLED;

  /**
   * Returns {@code true} for outcomes that fail a run: assertion failures and uncaught faults.
   */
  public boolean isFailure() {
    return this == FAILURE || this == ERROR;
  }

  /**
   * Combines the outcomes of a suite's children into the outcome of the suite.
   *
   * @param childStates The outcomes of every child, in any order.
   * @return The aggregate outcome.
   */
  public static ResultState aggregate(Iterable<ResultState> childStates) {
    boolean anyCancelled = false;
    boolean anySuccess = false;
    boolean anyInconclusive = false;
    boolean anySkipped = false;
    for (ResultState state : childStates) {
      switch (state) {
        case FAILURE:
        case ERROR:
          return FAILURE;
        case CANCELLED:
          anyCancelled = true;
          break;
        case SUCCESS:
          anySuccess = true;
          break;
        case INCONCLUSIVE:
          anyInconclusive = true;
          break;
        case SKIPPED:
          anySkipped = true;
          break;
        default:
          throw new IllegalStateException("Unhandled state " + state);
      }
    }
    if (anyCancelled) {
      return CANCELLED;
    }
    if (anySuccess) {
      return SUCCESS;
    }
    if (anyInconclusive) {
      return INCONCLUSIVE;
    }
    return anySkipped ? SKIPPED : SUCCESS;
  }
}
