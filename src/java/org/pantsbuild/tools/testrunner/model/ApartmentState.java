// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

/**
 * The thread affinity a test body asks for.
 * <P>
 * Items requiring {@link #STA} all run on one dedicated thread per queue set, so a test body that
 * touches thread-confined state sees the same thread every time. {@link #MTA} items get their own
 * lane, apart from the general parallel pool. {@link #UNKNOWN} means the test does not care.
 * </P>
 */
public enum ApartmentState {
  UNKNOWN,
  STA,
  MTA;

  public boolean isRequirement() {
    return this != UNKNOWN;
  }
}
