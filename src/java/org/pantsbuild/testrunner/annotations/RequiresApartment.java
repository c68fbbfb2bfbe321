// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.testrunner.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotate that a test class or method must run on a thread dedicated to the named apartment.
 * All tests requiring the same apartment share that thread, so they never run concurrently with
 * each other.
 */
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresApartment {

  /**
   * The apartment kinds a test can ask for.
   */
  enum Kind {
    /** Single-threaded apartment. */
    STA,
    /** Multi-threaded apartment. */
    MTA
  }

  Kind value();
}
