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
import static com.google.common.base.Preconditions.checkState;

import com.google.scoperename.ast.ExprContext;
import com.google.scoperename.ast.Node;
import com.google.scoperename.ast.Token;
import com.google.scoperename.rename.RenamingOptions.LoopScoping;
import org.jspecify.annotations.Nullable;

/**
 * Walks a module once, depth first, binding every name in the frame of the construct that
 * declares it and rewriting every use to the alias visible at that point.
 *
 * <p>The walk is a single forward pass: a use is resolved against the bindings made before it, so
 * a binding later in a frame does not affect earlier uses. What gets an alias is decided by the
 * {@link Renamer}.
 *
 * <p>An instance renames one tree; create a new one per rename.
 */
final class RenameBindings {

  /** Decides which bindings get aliases and how free names are resolved. */
  interface Renamer {

    /** Returns the alias for a name bound for the first time in a frame. */
    String mintAlias(String name);

    /** Binds the name an import introduces, rewriting its {@code as} name as needed. */
    void bindImport(ScopeStack scopes, Node alias, boolean fromImport);

    /**
     * @return A replacement for a loaded name no live frame binds, null to leave it alone.
     */
    @Nullable String getReplacementForFreeName(String name);

    /**
     * @param declaration {@link Token#GLOBAL} or {@link Token#NONLOCAL}
     * @return The alias a declared name refers to, null if it is unknown.
     */
    @Nullable String getReplacementForDeclaration(
        ScopeStack scopes, Token declaration, String name);
  }

  private final ScopeStack scopes;
  private final Renamer renamer;
  private final LoopScoping loopScoping;
  private final int maxNestingDepth;

  RenameBindings(
      Renamer renamer, AliasMap.Builder aliasMap, LoopScoping loopScoping, int maxNestingDepth) {
    this.renamer = checkNotNull(renamer);
    this.loopScoping = checkNotNull(loopScoping);
    this.maxNestingDepth = maxNestingDepth;
    this.scopes = new ScopeStack(renamer::mintAlias, aliasMap, maxNestingDepth);
  }

  /** Creates a walker for the policy and limits in {@code options}. */
  static RenameBindings create(
      RenamingOptions options,
      AliasGenerator generator,
      RedirectTable redirects,
      AliasMap.Builder aliasMap) {
    Renamer renamer =
        switch (options.getPolicy()) {
          case FULL -> new FullRenamer(generator, redirects);
          case SELECTIVE -> new SelectiveRenamer(generator, redirects, aliasMap);
        };
    return new RenameBindings(
        renamer, aliasMap, options.getLoopScoping(), options.getMaxNestingDepth());
  }

  /** Renames {@code module} in place. */
  void process(Node module) {
    checkArgument(module.getToken() == Token.MODULE, "expected a module: %s", module);
    checkState(scopes.isEmpty(), "a RenameBindings instance renames one tree");
    scopes.push(Scope.Kind.MODULE, module);
    visitChildren(module);
    scopes.pop();
  }

  private void visit(Node n) {
    switch (n.getToken()) {
      case MODULE -> throw new IllegalStateException("nested module: " + n);
      case FUNCTION_DEF -> visitFunction(n);
      case LAMBDA -> visitLambda(n);
      case CLASS_DEF -> visitClass(n);
      case ASSIGN -> visitAssign(n);
      case ANN_ASSIGN, AUG_ASSIGN -> visitSingleTargetAssign(n);
      case FOR -> visitFor(n);
      case WHILE -> visitWhile(n);
      case WITH -> visitWith(n);
      case EXCEPT_HANDLER -> visitExceptHandler(n);
      case IMPORT -> visitImport(n, false);
      case IMPORT_FROM -> visitImport(n, true);
      case GLOBAL, NONLOCAL -> visitScopeDeclaration(n);
      case DELETE -> visitDelete(n);
      case NAME -> visitName(n);
      case LIST_COMP, SET_COMP, GENERATOR_EXP -> visitComprehension(n, 1);
      case DICT_COMP -> visitComprehension(n, 2);
      case NAMED_EXPR -> visitNamedExpr(n);
      case JOINED_STR, FORMATTED_VALUE -> visitChildren(n);
      case PARAM_LIST, PARAM, WITH_ITEM, ALIAS, COMPREHENSION ->
          throw new IllegalStateException(n.getToken() + " outside of its parent: " + n);
      case BLOCK,
          DECORATORS,
          BASES,
          IF,
          TRY,
          RETURN,
          EXPR_STMT,
          RAISE,
          ASSERT,
          PASS,
          BREAK,
          CONTINUE,
          ATTRIBUTE,
          SUBSCRIPT,
          SLICE,
          STARRED,
          TUPLE,
          LIST,
          SET,
          DICT,
          CALL,
          KEYWORD,
          BIN_OP,
          UNARY_OP,
          BOOL_OP,
          COMPARE,
          IF_EXP,
          AWAIT,
          YIELD,
          CONSTANT,
          EMPTY -> visitChildren(n);
    }
  }

  private void visitChildren(Node n) {
    for (Node child : n.children()) {
      visit(child);
    }
  }

  // ==========================================================================
  // Definitions

  private void visitFunction(Node n) {
    Node decorators = n.getFirstChild();
    Node params = decorators.getNext();
    Node returns = params.getNext();
    Node body = returns.getNext();

    visitChildren(decorators);
    visitParameterDefaults(params);
    visit(returns);
    n.setString(scopes.bind(n.getString()));

    scopes.push(Scope.Kind.FUNCTION, n);
    bindParameters(params);
    visitChildren(body);
    scopes.pop();
  }

  private void visitLambda(Node n) {
    Node params = n.getFirstChild();
    Node body = params.getNext();

    visitParameterDefaults(params);

    scopes.push(Scope.Kind.LAMBDA, n);
    bindParameters(params);
    visit(body);
    scopes.pop();
  }

  private void visitClass(Node n) {
    Node decorators = n.getFirstChild();
    Node bases = decorators.getNext();
    Node body = bases.getNext();

    visitChildren(decorators);
    visitChildren(bases);
    n.setString(scopes.bind(n.getString()));

    scopes.push(Scope.Kind.CLASS, n);
    visitChildren(body);
    scopes.pop();
  }

  /** Annotations and defaults belong to the enclosing scope. */
  private void visitParameterDefaults(Node params) {
    for (Node param : params.children()) {
      visitChildren(param);
    }
  }

  private void bindParameters(Node params) {
    for (Node param : params.children()) {
      param.setString(scopes.bind(param.getString()));
    }
  }

  // ==========================================================================
  // Binding statements

  private void visitAssign(Node n) {
    Node value = n.getLastChild();
    for (Node target = n.getFirstChild(); target != value; target = target.getNext()) {
      bindTarget(target);
    }
    visit(value);
  }

  /** Annotated and augmented assignments: target first, then annotation and value. */
  private void visitSingleTargetAssign(Node n) {
    Node target = n.getFirstChild();
    bindTarget(target);
    for (Node rest = target.getNext(); rest != null; rest = rest.getNext()) {
      visit(rest);
    }
  }

  private void visitFor(Node n) {
    Node target = n.getFirstChild();
    Node iterable = target.getNext();
    Node body = iterable.getNext();
    Node orElse = body.getNext();

    visit(iterable);
    bindTarget(target);
    visitLoopBody(n, Scope.Kind.LOOP, body, orElse);
  }

  private void visitWhile(Node n) {
    Node condition = n.getFirstChild();
    Node body = condition.getNext();
    Node orElse = body.getNext();

    visit(condition);
    visitLoopBody(n, Scope.Kind.LOOP, body, orElse);
  }

  private void visitWith(Node n) {
    Node body = n.getLastChild();
    for (Node item = n.getFirstChild(); item != body; item = item.getNext()) {
      Node contextExpression = item.getFirstChild();
      Node target = contextExpression.getNext();
      visit(contextExpression);
      if (!target.isEmpty()) {
        bindTarget(target);
      }
    }
    visitLoopBody(n, Scope.Kind.RESOURCE, body);
  }

  private void visitLoopBody(Node n, Scope.Kind kind, Node... blocks) {
    boolean isolated = loopScoping == LoopScoping.ISOLATED;
    if (isolated) {
      scopes.push(kind, n);
    }
    for (Node block : blocks) {
      visitChildren(block);
    }
    if (isolated) {
      scopes.pop();
    }
  }

  private void visitExceptHandler(Node n) {
    Node type = n.getFirstChild();
    Node body = type.getNext();
    visit(type);
    if (n.hasString()) {
      n.setString(scopes.bind(n.getString()));
    }
    visitChildren(body);
  }

  private void visitImport(Node n, boolean fromImport) {
    for (Node alias : n.children()) {
      if (alias.getString().equals("*")) {
        continue;
      }
      renamer.bindImport(scopes, alias, fromImport);
    }
  }

  private void visitScopeDeclaration(Node n) {
    for (Node name : n.children()) {
      String original = name.getString();
      String alias = renamer.getReplacementForDeclaration(scopes, n.getToken(), original);
      if (alias == null) {
        scopes.declare(original, original);
      } else {
        name.setString(alias);
        scopes.declare(original, alias);
      }
    }
  }

  private void visitDelete(Node n) {
    for (Node target : n.children()) {
      for (Node name : AssignmentTargets.collectBoundNames(target, maxNestingDepth)) {
        rewriteUse(name);
      }
      visitTargetUses(target);
    }
  }

  /**
   * Binds the simple names of an assignment target in the current frame and rewrites them, then
   * visits the sub-expressions of attribute and subscript targets as uses.
   */
  private void bindTarget(Node target) {
    for (Node name : AssignmentTargets.collectBoundNames(target, maxNestingDepth)) {
      name.setString(scopes.bind(name.getString()));
    }
    visitTargetUses(target);
  }

  private void visitTargetUses(Node target) {
    switch (target.getToken()) {
      case TUPLE:
      case LIST:
      case STARRED:
        for (Node element : target.children()) {
          visitTargetUses(element);
        }
        break;
      case ATTRIBUTE:
      case SUBSCRIPT:
        visitChildren(target);
        break;
      default:
        break;
    }
  }

  // ==========================================================================
  // Uses

  private void visitName(Node n) {
    ExprContext context = n.getContext();
    if (context == ExprContext.STORE || context == ExprContext.DEL) {
      return;
    }
    rewriteUse(n);
  }

  private void rewriteUse(Node name) {
    String original = name.getString();
    String alias = scopes.lookup(original);
    if (alias == null) {
      alias = renamer.getReplacementForFreeName(original);
    }
    if (alias != null) {
      name.setString(alias);
    }
  }

  /**
   * The value is evaluated before the name is bound. Inside a comprehension the name belongs to
   * the code around it.
   */
  private void visitNamedExpr(Node n) {
    Node target = n.getFirstChild();
    visit(target.getNext());
    Node name = AssignmentTargets.checkNamedExprTarget(target);
    name.setString(scopes.bindOutsideComprehensions(name.getString()));
  }

  /**
   * The first iterable is evaluated in the enclosing scope. Everything else, including the
   * element, sees the comprehension's own frame.
   */
  private void visitComprehension(Node n, int elementCount) {
    Node firstGenerator = n.getChildAtIndex(elementCount);
    visit(firstGenerator.getFirstChild().getNext());

    scopes.push(Scope.Kind.COMPREHENSION, n);
    for (Node generator = firstGenerator; generator != null; generator = generator.getNext()) {
      Node target = generator.getFirstChild();
      Node iterable = target.getNext();
      if (generator != firstGenerator) {
        visit(iterable);
      }
      bindTarget(target);
      for (Node condition = iterable.getNext();
          condition != null;
          condition = condition.getNext()) {
        visit(condition);
      }
    }
    for (Node element = n.getFirstChild(); element != firstGenerator; element = element.getNext()) {
      visit(element);
    }
    scopes.pop();
  }

  // ==========================================================================
  // Renamers

  /** The top-level package of {@code import a.b.c}, which binds {@code a} itself. */
  private static @Nullable String dottedImportRoot(Node alias, boolean fromImport) {
    String name = alias.getString();
    int dot = name.indexOf('.');
    return fromImport || dot == -1 ? null : name.substring(0, dot);
  }

  /** Gives every binding a fresh alias. */
  static final class FullRenamer implements Renamer {
    private final AliasGenerator generator;
    private final RedirectTable redirects;

    FullRenamer(AliasGenerator generator, RedirectTable redirects) {
      this.generator = checkNotNull(generator);
      this.redirects = checkNotNull(redirects);
    }

    @Override
    public String mintAlias(String name) {
      return generator.generateAlias(name);
    }

    @Override
    public void bindImport(ScopeStack scopes, Node alias, boolean fromImport) {
      String asName = alias.getAsName();
      if (asName != null) {
        alias.setAsName(scopes.bind(asName));
        return;
      }
      String root = dottedImportRoot(alias, fromImport);
      if (root != null) {
        scopes.bindVerbatim(root);
        return;
      }
      String name = alias.getString();
      String replacement = scopes.bind(name);
      alias.setAsName(replacement);
      redirects.register(name, replacement);
    }

    @Override
    public @Nullable String getReplacementForFreeName(String name) {
      return null;
    }

    @Override
    public @Nullable String getReplacementForDeclaration(
        ScopeStack scopes, Token declaration, String name) {
      if (declaration == Token.NONLOCAL) {
        return scopes.lookupEnclosing(name);
      }
      String alias = scopes.lookupInOutermost(name);
      return alias != null ? alias : redirects.lookup(name);
    }
  }

  /**
   * Gives aliases only to imports without an {@code as} name. Other bindings map to themselves,
   * so they still shadow the imported names.
   */
  static final class SelectiveRenamer implements Renamer {
    private final AliasGenerator generator;
    private final RedirectTable redirects;
    private final AliasMap.Builder aliasMap;

    SelectiveRenamer(AliasGenerator generator, RedirectTable redirects, AliasMap.Builder aliasMap) {
      this.generator = checkNotNull(generator);
      this.redirects = checkNotNull(redirects);
      this.aliasMap = checkNotNull(aliasMap);
    }

    @Override
    public String mintAlias(String name) {
      return name;
    }

    @Override
    public void bindImport(ScopeStack scopes, Node alias, boolean fromImport) {
      String asName = alias.getAsName();
      if (asName != null) {
        scopes.bind(asName);
        return;
      }
      String root = dottedImportRoot(alias, fromImport);
      if (root != null) {
        scopes.bindVerbatim(root);
        return;
      }
      String name = alias.getString();
      String replacement = redirects.lookup(name);
      if (replacement == null) {
        replacement = generator.generateAlias(name);
        redirects.register(name, replacement);
        aliasMap.add(name, replacement);
      }
      alias.setAsName(replacement);
      scopes.bind(replacement);
    }

    @Override
    public @Nullable String getReplacementForFreeName(String name) {
      return redirects.lookup(name);
    }

    @Override
    public @Nullable String getReplacementForDeclaration(
        ScopeStack scopes, Token declaration, String name) {
      return redirects.lookup(name);
    }
  }
}
