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
import static com.google.common.base.Preconditions.checkState;

import com.google.scoperename.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The frames live at the current point of a traversal, innermost first.
 *
 * <p>Binding is idempotent within a frame: the first {@link #bind} of a name mints its alias and
 * every later one returns it. Lookup scans from the innermost frame outwards, so inner frames
 * shadow outer ones.
 */
final class ScopeStack {

  private final Deque<Scope> frames = new ArrayDeque<>();
  private final Function<String, String> aliasMinter;
  private final AliasMap.Builder aliasMap;
  private final int maxNestingDepth;

  /**
   * @param aliasMinter called with an original name whenever a frame binds it for the first time
   * @param aliasMap receives every binding whose alias differs from its name
   * @param maxNestingDepth maximum number of frames live at once
   */
  ScopeStack(
      Function<String, String> aliasMinter, AliasMap.Builder aliasMap, int maxNestingDepth) {
    this.aliasMinter = checkNotNull(aliasMinter);
    this.aliasMap = checkNotNull(aliasMap);
    this.maxNestingDepth = maxNestingDepth;
  }

  /**
   * Opens an empty frame for the construct {@code root}.
   *
   * @throws RenamingException if the frame would exceed the nesting limit
   */
  Scope push(Scope.Kind kind, Node root) {
    if (frames.size() >= maxNestingDepth) {
      throw new RenamingException(
          RenamingError.make(
              root, RenamingErrors.NESTING_LIMIT_EXCEEDED, maxNestingDepth, root.getToken()));
    }
    Scope scope = new Scope(kind, frames.size());
    frames.push(scope);
    return scope;
  }

  /** Discards the innermost frame and its bindings. */
  void pop() {
    checkState(!frames.isEmpty(), "pop on an empty scope stack");
    frames.pop();
  }

  Scope peek() {
    checkState(!frames.isEmpty(), "no live scope");
    return frames.peek();
  }

  /** Number of live frames. */
  int getDepth() {
    return frames.size();
  }

  boolean isEmpty() {
    return frames.isEmpty();
  }

  /** Returns the alias of {@code name} in the innermost frame, minting one if it has none. */
  String bind(String name) {
    return bindIn(peek(), name);
  }

  /**
   * Binds {@code name} in the innermost frame that is not a comprehension, the way an assignment
   * expression inside a comprehension binds in the code around it.
   */
  String bindOutsideComprehensions(String name) {
    for (Scope scope : frames) {
      if (scope.getKind() != Scope.Kind.COMPREHENSION) {
        return bindIn(scope, name);
      }
    }
    throw new IllegalStateException("no frame outside comprehensions");
  }

  private String bindIn(Scope scope, String name) {
    Binding existing = scope.getOwnBinding(name);
    if (existing != null) {
      return existing.alias();
    }
    Binding declaration = findDeclarationAround(scope, name);
    if (declaration != null) {
      scope.putBinding(declaration);
      return declaration.alias();
    }
    String alias = aliasMinter.apply(name);
    Binding binding = Binding.declared(name, alias);
    scope.putBinding(binding);
    if (binding.isRenamed()) {
      aliasMap.add(name, alias);
    }
    return alias;
  }

  /**
   * Looks through the loop and resource frames that enclose {@code scope} for the frame that
   * binds {@code name}, and returns its binding if that is a {@code global} or {@code nonlocal}
   * declaration.
   */
  private @Nullable Binding findDeclarationAround(Scope scope, String name) {
    Iterator<Scope> it = frames.iterator();
    Scope current = it.next();
    while (current != scope) {
      current = it.next();
    }
    while (current.getKind().isBlock() && it.hasNext()) {
      current = it.next();
      Binding binding = current.getOwnBinding(name);
      if (binding != null) {
        return binding.kind() == Binding.Kind.REDIRECTED ? binding : null;
      }
    }
    return null;
  }

  /**
   * Binds {@code name} to itself in the innermost frame, replacing any alias it had there. Later
   * loads in the frame and its children then keep the name.
   */
  void bindVerbatim(String name) {
    peek().putBinding(Binding.declared(name, name));
  }

  /** Makes {@code name} resolve to {@code alias} in the innermost frame. */
  void declare(String name, String alias) {
    peek().putBinding(Binding.redirected(name, alias));
  }

  /** Returns the alias {@code name} resolves to here, or null if no live frame binds it. */
  @Nullable String lookup(String name) {
    for (Scope scope : frames) {
      Binding binding = scope.getOwnBinding(name);
      if (binding != null) {
        return binding.alias();
      }
    }
    return null;
  }

  /** Returns the alias of {@code name} in the module frame, or null. */
  @Nullable String lookupInOutermost(String name) {
    if (frames.isEmpty()) {
      return null;
    }
    Binding binding = frames.getLast().getOwnBinding(name);
    return binding == null ? null : binding.alias();
  }

  /**
   * Returns the alias of {@code name} in the nearest frame strictly between the innermost and the
   * module frame, or null.
   */
  @Nullable String lookupEnclosing(String name) {
    Iterator<Scope> it = frames.iterator();
    if (!it.hasNext()) {
      return null;
    }
    it.next();
    while (it.hasNext()) {
      Scope scope = it.next();
      if (scope.getDepth() == 0) {
        break;
      }
      Binding binding = scope.getOwnBinding(name);
      if (binding != null) {
        return binding.alias();
      }
    }
    return null;
  }
}
