// Copyright 2016 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.impl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.junit.runners.model.FrameworkMethod;

/**
 * Turns the test specs passed on the command line into {@link Spec Specs}, one per class.
 * <p>
 * A spec is either {@code package.ClassName} or {@code package.ClassName#methodName}. Each class
 * or method runs once no matter how often it is named. Naming a whole class and also some of its
 * methods is an error. Classes that are not runnable tests are skipped.
 * </p>
 */
class SpecParser {
  private static final Logger logger = Logger.getLogger(SpecParser.class.getName());

  private static final Splitter METHOD_SPLITTER = Splitter.on('#');

  private final Iterable<String> testSpecStrings;
  private final Map<Class<?>, Spec> specs = new LinkedHashMap<Class<?>, Spec>();

  SpecParser(Iterable<String> testSpecStrings) {
    Preconditions.checkArgument(!Iterables.isEmpty(testSpecStrings), "No tests to parse");
    this.testSpecStrings = testSpecStrings;
  }

  /**
   * @return The parsed specs, in the order their classes were first named.
   * @throws SpecException If a spec names a missing class or method, or cannot be loaded.
   */
  List<Spec> parse() throws SpecException {
    for (String specString : testSpecStrings) {
      if (specString.isEmpty()) {
        continue;
      }
      if (specString.indexOf('#') >= 0) {
        addMethod(specString);
      } else {
        Class<?> clazz = loadTestClass(specString, specString);
        if (clazz == null) {
          continue;
        }
        Spec existing = specs.get(clazz);
        if (existing != null && !existing.getMethods().isEmpty()) {
          throw new SpecException(specString,
              "Request for entire class already requesting individual methods");
        }
        if (existing == null) {
          specs.put(clazz, new Spec(clazz));
        }
      }
    }
    return ImmutableList.copyOf(specs.values());
  }

  private void addMethod(String specString) throws SpecException {
    List<String> parts = METHOD_SPLITTER.splitToList(specString);
    if (parts.size() != 2) {
      throw new SpecException(specString, "Expected only one # in spec");
    }
    String className = parts.get(0);
    String methodName = parts.get(1);

    Class<?> clazz = loadTestClass(className, specString);
    if (clazz == null) {
      return;
    }
    Spec existing = specs.get(clazz);
    if (existing != null && existing.getMethods().isEmpty()) {
      throw new SpecException(specString,
          "Request for individual method when the entire class is already requested");
    }
    List<FrameworkMethod> methods;
    try {
      methods = Util.getTestMethods(clazz);
    } catch (IllegalArgumentException e) {
      throw new SpecException(specString,
          String.format("Cannot read the test methods of %s", className), e);
    }
    for (FrameworkMethod method : methods) {
      if (method.getName().equals(methodName)) {
        Spec spec = existing == null ? new Spec(clazz) : existing;
        specs.put(clazz, spec.withMethod(methodName));
        return;
      }
    }
    throw new SpecException(specString,
        String.format("Method %s not found in class %s", methodName, className));
  }

  /**
   * @return The named class, or {@code null} if it is not a runnable test class.
   */
  @Nullable
  private Class<?> loadTestClass(String className, String specString) throws SpecException {
    Class<?> clazz;
    try {
      clazz = getClass().getClassLoader().loadClass(className);
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      throw new SpecException(specString,
          String.format("Class %s not found in classpath.", className), e);
    } catch (LinkageError e) {
      throw new SpecException(specString, String.format("Error linking %s.", className), e);
    } catch (RuntimeException e) {
      // Static initializers can fail with any RuntimeException.
      throw new SpecException(specString, String.format("Error initializing %s.", className), e);
    }
    if (!Util.isTestClass(clazz)) {
      logger.fine("Skipping " + className + ": not a runnable test class");
      return null;
    }
    return clazz;
  }
}
