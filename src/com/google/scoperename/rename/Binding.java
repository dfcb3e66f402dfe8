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

import com.google.auto.value.AutoValue;

/** An original name and the alias it resolves to within one frame. */
@AutoValue
abstract class Binding {

  enum Kind {
    /** Created by a binding site in the frame itself. */
    DECLARED,
    /** Created by a {@code global} or {@code nonlocal} declaration pointing at an outer binding. */
    REDIRECTED
  }

  static Binding declared(String originalName, String alias) {
    return new AutoValue_Binding(originalName, alias, Kind.DECLARED);
  }

  static Binding redirected(String originalName, String alias) {
    return new AutoValue_Binding(originalName, alias, Kind.REDIRECTED);
  }

  abstract String originalName();

  abstract String alias();

  abstract Kind kind();

  /** Whether the alias differs from the original name. */
  final boolean isRenamed() {
    return !alias().equals(originalName());
  }
}
