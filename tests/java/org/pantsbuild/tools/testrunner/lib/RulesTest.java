// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.lib;

import java.io.File;

import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExternalResource;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertTrue;

/**
 * Uses a method rule and a class rule. Run by the tree builder tests.
 */
public class RulesTest {
  @ClassRule
  public static final ExternalResource SERVER = new ExternalResource() {
    @Override
    protected void before() {
      TestRegistry.registerTestCall("serverUp");
    }

    @Override
    protected void after() {
      TestRegistry.registerTestCall("serverDown");
    }
  };

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testWritesToTemporaryFolder() throws Exception {
    File file = folder.newFile("scratch.txt");
    assertTrue(file.exists());
    TestRegistry.registerTestCall("wrote");
  }
}
