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

import java.util.Random;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Generates aliases of the form {@code n} followed by eight characters drawn uniformly from
 * {@code [0-9A-Za-z]}, e.g. {@code nQ3fk0Zpa}. The hint is ignored.
 */
public final class RandomAliasGenerator extends AbstractAliasGenerator {

  static final String PREFIX = "n";

  static final int SUFFIX_LENGTH = 8;

  static final String ALPHABET =
      "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

  public RandomAliasGenerator(Set<String> reservedNames, Random random, int maxAttempts) {
    super(reservedNames, random, maxAttempts);
  }

  @Override
  public RandomAliasGenerator clone(Set<String> reservedNames, Random random) {
    return new RandomAliasGenerator(reservedNames, random, getMaxAttempts());
  }

  @Override
  String nextCandidate(@Nullable String hint) {
    StringBuilder sb = new StringBuilder(PREFIX.length() + SUFFIX_LENGTH);
    sb.append(PREFIX);
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }
}
