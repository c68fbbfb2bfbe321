// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.testrunner.model;

import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One node of a test tree: either a leaf test case with an executable body, or a composite suite
 * or fixture with ordered children.
 * <P>
 * A composite marked isolated is an isolation boundary: its children may run in parallel with
 * each other, but they are scheduled on queues of their own and other work is held back until they
 * finish, so they never interleave with the composite's siblings.
 * </P>
 */
public final class TestNode {

  public enum Kind {
    LEAF,
    COMPOSITE
  }

  private final String id;
  private final String name;
  private final Kind kind;
  private final boolean parallelizable;
  private final boolean isolated;
  private final ApartmentState requiredApartment;
  private final long timeoutMillis;
  @Nullable private final String ignoreReason;
  @Nullable private final TestAction action;
  @Nullable private final TestAction setUp;
  @Nullable private final TestAction tearDown;
  @Nullable private final TestFixture fixture;
  private final ImmutableList<TestNode> children;

  private TestNode(Builder builder) {
    this.id = builder.id != null ? builder.id : builder.name;
    this.name = builder.name;
    this.kind = builder.kind;
    this.parallelizable = builder.parallelizable;
    this.isolated = builder.isolated;
    this.requiredApartment = builder.requiredApartment;
    this.timeoutMillis = builder.timeoutMillis;
    this.ignoreReason = builder.ignoreReason;
    this.action = builder.action;
    this.setUp = builder.setUp;
    this.tearDown = builder.tearDown;
    this.fixture = builder.fixture;
    this.children = builder.children.build();
  }

  /**
   * Starts building a leaf test case.
   */
  public static Builder leaf(String name, TestAction action) {
    Preconditions.checkNotNull(action);
    Builder builder = new Builder(name, Kind.LEAF);
    builder.action = action;
    return builder;
  }

  /**
   * Starts building a suite or fixture.
   */
  public static Builder composite(String name) {
    return new Builder(name, Kind.COMPOSITE);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isLeaf() {
    return kind == Kind.LEAF;
  }

  public boolean isComposite() {
    return kind == Kind.COMPOSITE;
  }

  public boolean isParallelizable() {
    return parallelizable;
  }

  /**
   * Returns {@code true} if this node's children get a queue set of their own.
   */
  public boolean isIsolationBoundary() {
    return isComposite() && isolated;
  }

  public ApartmentState getRequiredApartment() {
    return requiredApartment;
  }

  /**
   * The time a leaf may run before it is cancelled, or 0 for no limit.
   */
  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public boolean isIgnored() {
    return ignoreReason != null;
  }

  @Nullable
  public String getIgnoreReason() {
    return ignoreReason;
  }

  @Nullable
  public TestAction getAction() {
    return action;
  }

  @Nullable
  public TestAction getSetUp() {
    return setUp;
  }

  @Nullable
  public TestAction getTearDown() {
    return tearDown;
  }

  /**
   * The fixture wrapped around the children, inside the set-up and tear-down.
   */
  @Nullable
  public TestFixture getFixture() {
    return fixture;
  }

  public ImmutableList<TestNode> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    return name;
  }

  public static final class Builder {
    private final String name;
    private final Kind kind;
    @Nullable private String id;
    private boolean parallelizable;
    private boolean isolated;
    private ApartmentState requiredApartment = ApartmentState.UNKNOWN;
    private long timeoutMillis;
    @Nullable private String ignoreReason;
    @Nullable private TestAction action;
    @Nullable private TestAction setUp;
    @Nullable private TestAction tearDown;
    @Nullable private TestFixture fixture;
    private final ImmutableList.Builder<TestNode> children = ImmutableList.builder();

    private Builder(String name, Kind kind) {
      Preconditions.checkNotNull(name);
      Preconditions.checkArgument(!name.isEmpty(), "A test name cannot be empty");
      this.name = name;
      this.kind = kind;
    }

    public Builder id(String id) {
      this.id = Preconditions.checkNotNull(id);
      return this;
    }

    public Builder parallelizable(boolean parallelizable) {
      this.parallelizable = parallelizable;
      return this;
    }

    public Builder isolated(boolean isolated) {
      Preconditions.checkState(kind == Kind.COMPOSITE, "Only suites can isolate their children");
      this.isolated = isolated;
      return this;
    }

    public Builder requiredApartment(ApartmentState requiredApartment) {
      this.requiredApartment = Preconditions.checkNotNull(requiredApartment);
      return this;
    }

    public Builder timeoutMillis(long timeoutMillis) {
      Preconditions.checkArgument(timeoutMillis >= 0, "timeout cannot be negative: %s",
          timeoutMillis);
      Preconditions.checkState(kind == Kind.LEAF, "Only test cases take a timeout");
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public Builder ignore(String reason) {
      this.ignoreReason = Preconditions.checkNotNull(reason);
      return this;
    }

    public Builder setUp(TestAction setUp) {
      Preconditions.checkState(kind == Kind.COMPOSITE, "Only suites have a one-time set-up");
      this.setUp = Preconditions.checkNotNull(setUp);
      return this;
    }

    public Builder tearDown(TestAction tearDown) {
      Preconditions.checkState(kind == Kind.COMPOSITE, "Only suites have a one-time tear-down");
      this.tearDown = Preconditions.checkNotNull(tearDown);
      return this;
    }

    public Builder fixture(TestFixture fixture) {
      Preconditions.checkState(kind == Kind.COMPOSITE, "Only suites wrap their children");
      this.fixture = Preconditions.checkNotNull(fixture);
      return this;
    }

    public Builder addChild(TestNode child) {
      Preconditions.checkState(kind == Kind.COMPOSITE, "A test case cannot have children");
      children.add(Preconditions.checkNotNull(child));
      return this;
    }

    public Builder addChild(Builder child) {
      return addChild(child.build());
    }

    public Builder addChildren(List<TestNode> nodes) {
      for (TestNode node : nodes) {
        addChild(node);
      }
      return this;
    }

    public TestNode build() {
      return new TestNode(this);
    }
  }
}
