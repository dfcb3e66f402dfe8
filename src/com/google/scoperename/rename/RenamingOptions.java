/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.scoperename.rename;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Options for a rename. Must not be mutated while a rename that uses them is running. */
public class RenamingOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Which bindings a rename replaces with aliases. */
  public enum Policy {
    /** Every user binding and every load that resolves to one. */
    FULL,
    /** Only imports without an explicit {@code as} name, and free loads of those names. */
    SELECTIVE
  }

  /** The shape of generated aliases. */
  public enum AliasStyle {
    /** {@code n} followed by eight random alphanumerics. */
    RANDOM,
    /** {@code _}, six hex digits of a hash of the original name, three random letters. */
    HASH_SEEDED
  }

  /** Whether loop and {@code with} bodies get their own frame. */
  public enum LoopScoping {
    /** Bindings made in a loop or {@code with} body are invisible after it. */
    ISOLATED,
    /** Loop and {@code with} bodies bind into the enclosing frame, as the language does. */
    LEAKING
  }

  private Policy policy = Policy.FULL;

  private @Nullable Long seed;

  private AliasStyle aliasStyle = AliasStyle.RANDOM;

  private LoopScoping loopScoping = LoopScoping.ISOLATED;

  private int maxNestingDepth = 100;

  private int maxAliasAttempts = 64;

  /**
   * Read by the literal encoding collaborator, which leaves a leading string literal of a module,
   * function or class body alone. The renamer itself never touches literals.
   */
  private boolean preserveDocstringLikeLeadingLiteral = true;

  public Policy getPolicy() {
    return policy;
  }

  public void setPolicy(Policy policy) {
    this.policy = checkNotNull(policy);
  }

  /** Returns the seed of the alias generator, or null when every run draws a fresh one. */
  public @Nullable Long getSeed() {
    return seed;
  }

  public void setSeed(@Nullable Long seed) {
    this.seed = seed;
  }

  public AliasStyle getAliasStyle() {
    return aliasStyle;
  }

  public void setAliasStyle(AliasStyle aliasStyle) {
    this.aliasStyle = checkNotNull(aliasStyle);
  }

  public LoopScoping getLoopScoping() {
    return loopScoping;
  }

  public void setLoopScoping(LoopScoping loopScoping) {
    this.loopScoping = checkNotNull(loopScoping);
  }

  public int getMaxNestingDepth() {
    return maxNestingDepth;
  }

  /**
   * Sets the maximum number of scope frames live at once, the module frame included. Sequence
   * targets may not nest deeper than this either.
   */
  public void setMaxNestingDepth(int maxNestingDepth) {
    this.maxNestingDepth = maxNestingDepth;
  }

  public int getMaxAliasAttempts() {
    return maxAliasAttempts;
  }

  /** Sets how many candidates an alias generator draws before giving up on one name. */
  public void setMaxAliasAttempts(int maxAliasAttempts) {
    this.maxAliasAttempts = maxAliasAttempts;
  }

  public boolean getPreserveDocstringLikeLeadingLiteral() {
    return preserveDocstringLikeLeadingLiteral;
  }

  public void setPreserveDocstringLikeLeadingLiteral(boolean preserve) {
    this.preserveDocstringLikeLeadingLiteral = preserve;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("policy", policy)
        .add("seed", seed)
        .add("aliasStyle", aliasStyle)
        .add("loopScoping", loopScoping)
        .add("maxNestingDepth", maxNestingDepth)
        .add("maxAliasAttempts", maxAliasAttempts)
        .add("preserveDocstringLikeLeadingLiteral", preserveDocstringLikeLeadingLiteral)
        .toString();
  }
}
