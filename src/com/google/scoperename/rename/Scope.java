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

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** One frame of the scope stack: the bindings created while a construct is being walked. */
final class Scope {

  /** The construct that opened a frame. */
  enum Kind {
    MODULE,
    FUNCTION,
    LAMBDA,
    CLASS,
    COMPREHENSION,
    LOOP,
    RESOURCE;

    /**
     * Whether frames of this kind exist only because loop and resource bodies are isolated. Such
     * frames do not hide the {@code global} and {@code nonlocal} declarations of the frame around
     * them.
     */
    boolean isBlock() {
      return this == LOOP || this == RESOURCE;
    }
  }

  private final Kind kind;
  private final int depth;
  private final Map<String, Binding> bindings = new LinkedHashMap<>();

  Scope(Kind kind, int depth) {
    this.kind = checkNotNull(kind);
    this.depth = depth;
  }

  Kind getKind() {
    return kind;
  }

  /** Zero for the module frame. */
  int getDepth() {
    return depth;
  }

  @Nullable Binding getOwnBinding(String name) {
    return bindings.get(name);
  }

  /** Adds or replaces the binding of {@code binding.originalName()}. */
  void putBinding(Binding binding) {
    bindings.put(binding.originalName(), binding);
  }

  @Override
  public String toString() {
    return kind + "@" + depth + bindings.values();
  }
}
