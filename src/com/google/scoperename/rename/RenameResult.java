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

import com.google.common.collect.ImmutableMap;
import com.google.scoperename.ast.Node;

/** The outcome of a successful rename. */
public final class RenameResult {

  private final Node root;
  private final AliasMap aliasMap;
  private final ImmutableMap<String, String> redirectTable;

  RenameResult(Node root, AliasMap aliasMap, ImmutableMap<String, String> redirectTable) {
    this.root = checkNotNull(root);
    this.aliasMap = checkNotNull(aliasMap);
    this.redirectTable = checkNotNull(redirectTable);
  }

  /** The renamed module. It shares no nodes with the input. */
  public Node getRoot() {
    return root;
  }

  public AliasMap getAliasMap() {
    return aliasMap;
  }

  /** Imported names mapped to the alias their first import received. */
  public ImmutableMap<String, String> getRedirectTable() {
    return redirectTable;
  }
}
