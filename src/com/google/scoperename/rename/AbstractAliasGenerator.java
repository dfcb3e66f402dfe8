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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.scoperename.ast.Keywords;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Draws random candidates until one is free.
 *
 * <p>This class is not thread safe.
 */
abstract class AbstractAliasGenerator implements AliasGenerator {

  /** Names that are not returned by generateAlias. Referenced, not copied. */
  private final Set<String> reservedNames;

  /** Everything this generator has returned so far. */
  private final Set<String> generated = new HashSet<>();

  /** Source of randomness */
  protected final Random random;

  private final int maxAttempts;

  AbstractAliasGenerator(Set<String> reservedNames, Random random, int maxAttempts) {
    checkArgument(maxAttempts > 0, "maxAttempts must be positive: %s", maxAttempts);
    this.reservedNames = checkNotNull(reservedNames);
    this.random = checkNotNull(random);
    this.maxAttempts = maxAttempts;
  }

  int getMaxAttempts() {
    return maxAttempts;
  }

  /** Returns one candidate; it is checked for freshness by the caller. */
  abstract String nextCandidate(@Nullable String hint);

  @Override
  public final String generateAlias(@Nullable String hint) {
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      String candidate = nextCandidate(hint);
      if (Keywords.isKeyword(candidate) || reservedNames.contains(candidate)) {
        continue;
      }
      if (generated.add(candidate)) {
        return candidate;
      }
    }
    throw new RenamingException(
        RenamingError.make(
            RenamingErrors.ALIAS_EXHAUSTION, hint == null ? "" : hint, maxAttempts));
  }
}
