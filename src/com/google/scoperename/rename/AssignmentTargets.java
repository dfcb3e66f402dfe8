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

import com.google.common.collect.ImmutableList;
import com.google.scoperename.ast.Node;

/**
 * Decomposes assignment targets into the simple names they bind.
 *
 * <p>Tuples and lists are flattened, starred elements unwrapped. Attribute and subscript targets
 * bind nothing; their sub-expressions are uses.
 */
final class AssignmentTargets {

  private AssignmentTargets() {}

  /**
   * Returns the NAME nodes bound by {@code target}, in source order.
   *
   * @param maxDepth how deeply sequence targets may nest
   * @throws RenamingException with {@link RenamingErrors#MALFORMED_TARGET} if {@code target}
   *     cannot be decomposed
   */
  static ImmutableList<Node> collectBoundNames(Node target, int maxDepth) {
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    collect(target, names, 0, maxDepth, false);
    return names.build();
  }

  /**
   * Returns the NAME an assignment expression binds.
   *
   * @throws RenamingException with {@link RenamingErrors#MALFORMED_TARGET} if {@code target} is
   *     anything else
   */
  static Node checkNamedExprTarget(Node target) {
    if (!target.isName()) {
      throw malformed(target, "an assignment expression can only bind a name");
    }
    return target;
  }

  private static void collect(
      Node target, ImmutableList.Builder<Node> names, int depth, int maxDepth, boolean inSequence) {
    switch (target.getToken()) {
      case NAME:
        names.add(target);
        return;
      case ATTRIBUTE:
      case SUBSCRIPT:
        return;
      case STARRED:
        if (!inSequence) {
          throw malformed(target, "starred target outside a tuple or list");
        }
        Node value = target.getFirstChild();
        if (value.isStarred()) {
          throw malformed(target, "nested starred target");
        }
        collect(value, names, depth, maxDepth, false);
        return;
      case TUPLE:
      case LIST:
        if (depth >= maxDepth) {
          throw malformed(target, "sequence targets nested deeper than " + maxDepth);
        }
        boolean seenStarred = false;
        for (Node element : target.children()) {
          if (element.isStarred()) {
            if (seenStarred) {
              throw malformed(target, "more than one starred target");
            }
            seenStarred = true;
          }
          collect(element, names, depth + 1, maxDepth, true);
        }
        return;
      default:
        throw malformed(target, "cannot assign to " + target.getToken());
    }
  }

  private static RenamingException malformed(Node target, String reason) {
    return new RenamingException(
        RenamingError.make(target, RenamingErrors.MALFORMED_TARGET, target.getToken(), reason));
  }
}
