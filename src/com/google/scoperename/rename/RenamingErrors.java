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

/** All errors a rename can fail with. */
public final class RenamingErrors {

  public static final DiagnosticType MALFORMED_TARGET =
      DiagnosticType.error(
          "SCOPE_MALFORMED_TARGET", "Cannot decompose {0} into simple names: {1}");

  public static final DiagnosticType NESTING_LIMIT_EXCEEDED =
      DiagnosticType.error(
          "SCOPE_NESTING_LIMIT_EXCEEDED",
          "Scope nesting depth exceeds the limit of {0} at {1}");

  public static final DiagnosticType ALIAS_EXHAUSTION =
      DiagnosticType.error(
          "SCOPE_ALIAS_EXHAUSTION",
          "Could not generate a fresh alias for \"{0}\" in {1} attempts");

  private RenamingErrors() {}
}
