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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.scoperename.ast.Node;
import com.google.scoperename.ast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Replaces the identifiers of a module with fresh aliases while keeping every reference bound to
 * the same declaration.
 *
 * <p>Each call to {@link #rename} works on a copy of its input with its own scope stack, redirect
 * table and alias generator, so one instance may serve several threads as long as its options
 * are not changed meanwhile.
 */
public final class IdentifierRenamer {

  private static final Logger logger = Logger.getLogger(IdentifierRenamer.class.getName());

  private final RenamingOptions options;
  private final @Nullable AliasGenerator aliasGenerator;

  public IdentifierRenamer(RenamingOptions options) {
    this(options, null);
  }

  private IdentifierRenamer(RenamingOptions options, @Nullable AliasGenerator aliasGenerator) {
    this.options = checkNotNull(options);
    this.aliasGenerator = aliasGenerator;
  }

  /**
   * Returns a renamer that draws aliases from clones of {@code prototype} instead of the
   * generator for the configured alias style.
   */
  public IdentifierRenamer withAliasGenerator(AliasGenerator prototype) {
    return new IdentifierRenamer(options, checkNotNull(prototype));
  }

  /**
   * Renames a copy of {@code module}. The argument is left untouched.
   *
   * @throws RenamingException if the tree holds a malformed target, nests too deeply, or runs the
   *     alias generator out of fresh names
   * @throws RenamingOptionsValidator.InvalidOptionsException if the options are invalid
   */
  public RenameResult rename(Node module) {
    checkArgument(module.getToken() == Token.MODULE, "expected a module: %s", module);
    RenamingOptionsValidator.validate(options);

    Node root = module.cloneTree();
    Long seed = options.getSeed();
    Random random = seed == null ? new Random() : new Random(seed);
    AliasGenerator generator = createAliasGenerator(collectIdentifiers(root), random);
    RedirectTable redirects = new RedirectTable();
    AliasMap.Builder aliasMap = AliasMap.builder();

    try {
      RenameBindings.create(options, generator, redirects, aliasMap).process(root);
    } catch (RenamingException e) {
      logger.log(Level.WARNING, "Rename failed: {0}", e.getError());
      throw e;
    }

    AliasMap aliases = aliasMap.build();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          String.format(
              "Renamed module with %s policy: %d aliases, %d redirects",
              options.getPolicy(), aliases.size(), redirects.size()));
    }
    return new RenameResult(root, aliases, redirects.asMap());
  }

  private AliasGenerator createAliasGenerator(ImmutableSet<String> reservedNames, Random random) {
    if (aliasGenerator != null) {
      return aliasGenerator.clone(reservedNames, random);
    }
    return switch (options.getAliasStyle()) {
      case RANDOM -> new RandomAliasGenerator(
          reservedNames, random, options.getMaxAliasAttempts());
      case HASH_SEEDED -> new HashSeededAliasGenerator(
          reservedNames, random, options.getMaxAliasAttempts());
    };
  }

  /** Returns every identifier spelled anywhere in the tree; aliases must not capture them. */
  static ImmutableSet<String> collectIdentifiers(Node root) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    Deque<Node> worklist = new ArrayDeque<>();
    worklist.push(root);
    while (!worklist.isEmpty()) {
      Node n = worklist.pop();
      switch (n.getToken()) {
        case NAME:
        case FUNCTION_DEF:
        case CLASS_DEF:
        case PARAM:
        case ATTRIBUTE:
        case KEYWORD:
        case EXCEPT_HANDLER:
          if (n.hasString()) {
            names.add(n.getString());
          }
          break;
        case ALIAS:
          names.addAll(Splitter.on('.').split(n.getString()));
          if (n.getAsName() != null) {
            names.add(n.getAsName());
          }
          break;
        default:
          break;
      }
      for (Node child : n.children()) {
        worklist.push(child);
      }
    }
    return names.build();
  }
}
