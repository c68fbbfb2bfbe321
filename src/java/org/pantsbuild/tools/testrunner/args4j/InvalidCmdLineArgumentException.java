// Copyright 2015 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.args4j;

import javax.annotation.Nullable;

/**
 * Thrown from the setters of an args4j options bean to reject a malformed value. args4j reports
 * it like any other parse failure.
 */
public class InvalidCmdLineArgumentException extends RuntimeException {

  /**
   * @param optionName The name of the option being parsed.
   * @param optionValue The raw value of the option being parsed.
   * @param message A message describing how the {@code optionValue} is invalid.
   */
  public InvalidCmdLineArgumentException(
      String optionName, @Nullable Object optionValue, String message) {

    super(
        String.format(
            "Invalid option value '%s' for option '%s': %s", optionValue, optionName, message));
  }
}
