// Copyright 2016 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.testrunner.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotate that methods in this test class can be run in parallel. The class runs in isolation:
 * no other test starts while its methods are running. If you want it to run alongside other
 * classes too, specify {@link TestParallelClassesAndMethods}. The {@link TestSerial} and
 * {@link TestParallel} annotations take precedence over this annotation if a class has multiple
 * annotations (including via inheritance).
 */
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Target(ElementType.TYPE)
public @interface TestParallelMethods {
}
