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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.Random;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Generates aliases of the form {@code _} + the first six hex digits of a hash of the hint + three
 * random lowercase letters, e.g. {@code _3f2a9cqwe}. Aliases of the same original name share
 * their hex part, which keeps renamed output diffable.
 */
public final class HashSeededAliasGenerator extends AbstractAliasGenerator {

  static final int HASH_LENGTH = 6;

  static final int SUFFIX_LENGTH = 3;

  private static final HashFunction HASH = Hashing.murmur3_128();

  public HashSeededAliasGenerator(Set<String> reservedNames, Random random, int maxAttempts) {
    super(reservedNames, random, maxAttempts);
  }

  @Override
  public HashSeededAliasGenerator clone(Set<String> reservedNames, Random random) {
    return new HashSeededAliasGenerator(reservedNames, random, getMaxAttempts());
  }

  /** Returns the hex part shared by every alias generated for {@code hint}. */
  static String hashPrefix(@Nullable String hint) {
    String hash = HASH.hashString(hint == null ? "" : hint, UTF_8).toString();
    return "_" + hash.substring(0, HASH_LENGTH);
  }

  @Override
  String nextCandidate(@Nullable String hint) {
    StringBuilder sb = new StringBuilder(hashPrefix(hint));
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      sb.append((char) ('a' + random.nextInt(26)));
    }
    return sb.toString();
  }
}
