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

/** Generates fresh aliases for the bindings of one rename. */
public interface AliasGenerator {

  /**
   * Returns a generator of the same kind, reset for a new run.
   *
   * @param reservedNames names that must never be generated. This set is referenced rather than
   *     copied.
   * @param random source of randomness for the new run
   */
  AliasGenerator clone(Set<String> reservedNames, Random random);

  /**
   * Generates an alias that is a valid identifier, is not a keyword, and has not been generated
   * or reserved before in this run.
   *
   * @param hint the original name being replaced, when there is one
   * @throws RenamingException with {@link RenamingErrors#ALIAS_EXHAUSTION} if no such alias can
   *     be found
   */
  String generateAlias(@Nullable String hint);
}
