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

/** Checks that a {@link RenamingOptions} describes a rename that can run. */
public final class RenamingOptionsValidator {

  private RenamingOptionsValidator() {}

  /**
   * @throws InvalidOptionsException if a numeric limit is out of range
   */
  public static void validate(RenamingOptions options) {
    if (options.getMaxNestingDepth() < 1) {
      throw new InvalidOptionsException(
          "maxNestingDepth must be at least 1, was %s", options.getMaxNestingDepth());
    }
    if (options.getMaxAliasAttempts() < 1) {
      throw new InvalidOptionsException(
          "maxAliasAttempts must be at least 1, was %s", options.getMaxAliasAttempts());
    }
  }

  /** Thrown when options are invalid. */
  public static class InvalidOptionsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }
}
