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

package com.google.scoperename.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>Builders that take an assignment, loop, resource or comprehension target mark the target
 * (and, for sequences, its elements) with {@link ExprContext#STORE}; {@link #delete} marks its
 * targets with {@link ExprContext#DEL}. All other expression builders produce loads.
 */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node module(Node... statements) {
    return module(ImmutableList.copyOf(statements));
  }

  public static Node module(List<Node> statements) {
    return new Node(Token.MODULE).addChildrenToBack(statements);
  }

  public static Node block(Node... statements) {
    return new Node(Token.BLOCK, statements);
  }

  // ==========================================================================
  // Definitions

  public static Node functionDef(String name, Node params, Node body) {
    return functionDef(name, decorators(), params, empty(), body);
  }

  public static Node functionDef(
      String name, Node decorators, Node params, Node returns, Node body) {
    checkState(decorators.getToken() == Token.DECORATORS, decorators);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    Node n = Node.newString(Token.FUNCTION_DEF, name);
    return n.addChildToBack(decorators)
        .addChildToBack(params)
        .addChildToBack(returns)
        .addChildToBack(body);
  }

  public static Node asyncFunctionDef(String name, Node params, Node body) {
    return functionDef(name, params, body).putBooleanProp(Node.Prop.ASYNC, true);
  }

  public static Node lambda(Node params, Node body) {
    checkState(params.isParamList(), params);
    return new Node(Token.LAMBDA, params, body);
  }

  public static Node classDef(String name, Node bases, Node body) {
    return classDef(name, decorators(), bases, body);
  }

  public static Node classDef(String name, Node decorators, Node bases, Node body) {
    checkState(decorators.getToken() == Token.DECORATORS, decorators);
    checkState(bases.getToken() == Token.BASES, bases);
    checkState(body.isBlock(), body);
    Node n = Node.newString(Token.CLASS_DEF, name);
    return n.addChildToBack(decorators).addChildToBack(bases).addChildToBack(body);
  }

  public static Node decorators(Node... expressions) {
    return new Node(Token.DECORATORS, expressions);
  }

  public static Node bases(Node... expressions) {
    return new Node(Token.BASES, expressions);
  }

  public static Node paramList() {
    return new Node(Token.PARAM_LIST);
  }

  public static Node paramList(Node... params) {
    for (Node param : params) {
      checkState(param.getToken() == Token.PARAM, param);
    }
    return new Node(Token.PARAM_LIST, params);
  }

  /** Builds a parameter list of plain positional parameters. */
  public static Node paramList(String... names) {
    Node list = new Node(Token.PARAM_LIST);
    for (String name : names) {
      list.addChildToBack(param(name));
    }
    return list;
  }

  public static Node param(String name) {
    return param(name, ParamKind.POSITIONAL);
  }

  public static Node param(String name, ParamKind kind) {
    return param(name, kind, empty(), empty());
  }

  public static Node param(
      String name, ParamKind kind, Node annotation, Node defaultValue) {
    checkArgument(
        defaultValue.isEmpty() || (kind != ParamKind.VARARG && kind != ParamKind.KWARG),
        "variadic parameter %s cannot have a default",
        name);
    Node n = Node.newString(Token.PARAM, name);
    n.putProp(Node.Prop.PARAM_KIND, kind);
    return n.addChildToBack(annotation).addChildToBack(defaultValue);
  }

  // ==========================================================================
  // Statements

  public static Node assign(Node target, Node value) {
    return new Node(Token.ASSIGN, asTarget(target, ExprContext.STORE), value);
  }

  /** Builds a chained assignment {@code t1 = t2 = ... = value}. */
  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty(), "assignment needs a target");
    Node n = new Node(Token.ASSIGN);
    for (Node target : targets) {
      n.addChildToBack(asTarget(target, ExprContext.STORE));
    }
    return n.addChildToBack(value);
  }

  public static Node annAssign(Node target, Node annotation, Node value) {
    return new Node(Token.ANN_ASSIGN, asTarget(target, ExprContext.STORE), annotation, value);
  }

  public static Node augAssign(String operator, Node target, Node value) {
    Node n = Node.newString(Token.AUG_ASSIGN, operator);
    return n.addChildToBack(asTarget(target, ExprContext.STORE)).addChildToBack(value);
  }

  public static Node forNode(Node target, Node iterable, Node body) {
    return forNode(target, iterable, body, block());
  }

  public static Node forNode(Node target, Node iterable, Node body, Node orElse) {
    checkState(body.isBlock(), body);
    checkState(orElse.isBlock(), orElse);
    return new Node(Token.FOR, asTarget(target, ExprContext.STORE), iterable, body, orElse);
  }

  public static Node whileNode(Node condition, Node body) {
    return whileNode(condition, body, block());
  }

  public static Node whileNode(Node condition, Node body, Node orElse) {
    checkState(body.isBlock(), body);
    checkState(orElse.isBlock(), orElse);
    return new Node(Token.WHILE, condition, body, orElse);
  }

  public static Node ifNode(Node condition, Node then) {
    return ifNode(condition, then, block());
  }

  public static Node ifNode(Node condition, Node then, Node orElse) {
    checkState(then.isBlock(), then);
    checkState(orElse.isBlock(), orElse);
    return new Node(Token.IF, condition, then, orElse);
  }

  public static Node with(List<Node> items, Node body) {
    checkArgument(!items.isEmpty(), "with statement needs an item");
    checkState(body.isBlock(), body);
    Node n = new Node(Token.WITH);
    for (Node item : items) {
      checkState(item.getToken() == Token.WITH_ITEM, item);
      n.addChildToBack(item);
    }
    return n.addChildToBack(body);
  }

  public static Node with(Node item, Node body) {
    return with(ImmutableList.of(item), body);
  }

  public static Node withItem(Node contextExpression) {
    return new Node(Token.WITH_ITEM, contextExpression, empty());
  }

  public static Node withItem(Node contextExpression, Node target) {
    return new Node(Token.WITH_ITEM, contextExpression, asTarget(target, ExprContext.STORE));
  }

  public static Node tryNode(Node body, List<Node> handlers, Node orElse, Node finallyBlock) {
    checkState(body.isBlock(), body);
    checkState(orElse.isBlock(), orElse);
    checkState(finallyBlock.isBlock(), finallyBlock);
    Node n = new Node(Token.TRY, body);
    for (Node handler : handlers) {
      checkState(handler.getToken() == Token.EXCEPT_HANDLER, handler);
      n.addChildToBack(handler);
    }
    return n.addChildToBack(orElse).addChildToBack(finallyBlock);
  }

  public static Node tryNode(Node body, Node... handlers) {
    return tryNode(body, ImmutableList.copyOf(handlers), block(), block());
  }

  /** Builds {@code except type as name:}; either part may be absent. */
  public static Node exceptHandler(Node type, @Nullable String name, Node body) {
    checkState(body.isBlock(), body);
    Node n = new Node(Token.EXCEPT_HANDLER, type, body);
    if (name != null) {
      n.setString(name);
    }
    return n;
  }

  public static Node importNode(Node... aliases) {
    return new Node(Token.IMPORT, checkAliases(aliases));
  }

  public static Node importFrom(@Nullable String module, Node... aliases) {
    return importFrom(module, 0, aliases);
  }

  public static Node importFrom(@Nullable String module, int level, Node... aliases) {
    checkArgument(module != null || level > 0, "absolute import needs a module");
    Node n = new Node(Token.IMPORT_FROM, checkAliases(aliases));
    if (module != null) {
      n.setString(module);
    }
    return n.putIntProp(Node.Prop.LEVEL, level);
  }

  private static Node[] checkAliases(Node[] aliases) {
    checkArgument(aliases.length > 0, "import needs at least one name");
    for (Node alias : aliases) {
      checkState(alias.getToken() == Token.ALIAS, alias);
    }
    return aliases;
  }

  public static Node alias(String name) {
    return Node.newString(Token.ALIAS, name);
  }

  public static Node alias(String name, String asName) {
    Node n = alias(name);
    n.setAsName(asName);
    return n;
  }

  public static Node global(String... names) {
    return declaration(Token.GLOBAL, names);
  }

  public static Node nonlocal(String... names) {
    return declaration(Token.NONLOCAL, names);
  }

  private static Node declaration(Token token, String... names) {
    checkArgument(names.length > 0, "%s needs at least one name", token);
    Node n = new Node(token);
    for (String name : names) {
      n.addChildToBack(name(name, ExprContext.STORE));
    }
    return n;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN, empty());
  }

  public static Node returnNode(Node value) {
    return new Node(Token.RETURN, value);
  }

  public static Node exprStmt(Node expression) {
    return new Node(Token.EXPR_STMT, expression);
  }

  public static Node raise(Node exception) {
    return new Node(Token.RAISE, exception, empty());
  }

  public static Node raise(Node exception, Node cause) {
    return new Node(Token.RAISE, exception, cause);
  }

  public static Node delete(Node... targets) {
    checkArgument(targets.length > 0, "del needs a target");
    Node n = new Node(Token.DELETE);
    for (Node target : targets) {
      n.addChildToBack(asTarget(target, ExprContext.DEL));
    }
    return n;
  }

  public static Node assertNode(Node test, Node message) {
    return new Node(Token.ASSERT, test, message);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  // ==========================================================================
  // Expressions

  public static Node name(String name) {
    return name(name, ExprContext.LOAD);
  }

  public static Node name(String name, ExprContext context) {
    return Node.newString(Token.NAME, name).putProp(Node.Prop.CONTEXT, context);
  }

  public static Node attribute(Node value, String attribute) {
    Node n = Node.newString(Token.ATTRIBUTE, attribute);
    return n.addChildToBack(value).putProp(Node.Prop.CONTEXT, ExprContext.LOAD);
  }

  public static Node subscript(Node value, Node index) {
    return new Node(Token.SUBSCRIPT, value, index).putProp(Node.Prop.CONTEXT, ExprContext.LOAD);
  }

  public static Node slice(Node lower, Node upper, Node step) {
    return new Node(Token.SLICE, lower, upper, step);
  }

  public static Node starred(Node value) {
    return new Node(Token.STARRED, value).putProp(Node.Prop.CONTEXT, ExprContext.LOAD);
  }

  public static Node tuple(Node... elements) {
    return new Node(Token.TUPLE, elements).putProp(Node.Prop.CONTEXT, ExprContext.LOAD);
  }

  public static Node list(Node... elements) {
    return new Node(Token.LIST, elements).putProp(Node.Prop.CONTEXT, ExprContext.LOAD);
  }

  public static Node set(Node... elements) {
    return new Node(Token.SET, elements);
  }

  /** Builds a dict display; children alternate key, value. */
  public static Node dict(Node... keysAndValues) {
    checkArgument(keysAndValues.length % 2 == 0, "dict needs key/value pairs");
    return new Node(Token.DICT, keysAndValues);
  }

  public static Node call(Node callee, Node... arguments) {
    Node n = new Node(Token.CALL, callee);
    for (Node argument : arguments) {
      n.addChildToBack(argument);
    }
    return n;
  }

  public static Node keyword(@Nullable String name, Node value) {
    Node n = new Node(Token.KEYWORD, value);
    if (name != null) {
      n.setString(name);
    }
    return n;
  }

  public static Node binOp(String operator, Node left, Node right) {
    return Node.newString(Token.BIN_OP, operator).addChildToBack(left).addChildToBack(right);
  }

  public static Node unaryOp(String operator, Node operand) {
    return Node.newString(Token.UNARY_OP, operator).addChildToBack(operand);
  }

  public static Node boolOp(String operator, Node... operands) {
    checkArgument(operands.length >= 2, "%s needs two operands", operator);
    Node n = Node.newString(Token.BOOL_OP, operator);
    for (Node operand : operands) {
      n.addChildToBack(operand);
    }
    return n;
  }

  public static Node compare(String operator, Node left, Node right) {
    return Node.newString(Token.COMPARE, operator).addChildToBack(left).addChildToBack(right);
  }

  public static Node ifExp(Node condition, Node body, Node orElse) {
    return new Node(Token.IF_EXP, condition, body, orElse);
  }

  public static Node await(Node value) {
    return new Node(Token.AWAIT, value);
  }

  public static Node yield(Node value) {
    return new Node(Token.YIELD, value);
  }

  public static Node listComp(Node element, Node... generators) {
    return new Node(Token.LIST_COMP, element).addChildrenToBack(checkGenerators(generators));
  }

  public static Node setComp(Node element, Node... generators) {
    return new Node(Token.SET_COMP, element).addChildrenToBack(checkGenerators(generators));
  }

  public static Node generatorExp(Node element, Node... generators) {
    return new Node(Token.GENERATOR_EXP, element).addChildrenToBack(checkGenerators(generators));
  }

  public static Node dictComp(Node key, Node value, Node... generators) {
    return new Node(Token.DICT_COMP, key, value).addChildrenToBack(checkGenerators(generators));
  }

  private static ImmutableList<Node> checkGenerators(Node[] generators) {
    checkArgument(generators.length > 0, "comprehension needs a for clause");
    for (Node generator : generators) {
      checkState(generator.isComprehension(), generator);
    }
    return ImmutableList.copyOf(generators);
  }

  public static Node comprehension(Node target, Node iterable, Node... conditions) {
    Node n = new Node(Token.COMPREHENSION, asTarget(target, ExprContext.STORE), iterable);
    for (Node condition : conditions) {
      n.addChildToBack(condition);
    }
    return n;
  }

  /** Builds {@code (target := value)}. */
  public static Node namedExpr(Node target, Node value) {
    return new Node(Token.NAMED_EXPR, asTarget(target, ExprContext.STORE), value);
  }

  /**
   * Builds an f-string. Each part is either a {@link Token#CONSTANT} holding literal text as it
   * reads once unescaped, without quotes, or a {@link Token#FORMATTED_VALUE}.
   */
  public static Node joinedStr(Node... parts) {
    for (Node part : parts) {
      checkState(isJoinedStrPart(part), part);
    }
    return new Node(Token.JOINED_STR, parts);
  }

  static boolean isJoinedStrPart(Node part) {
    return part.getToken() == Token.CONSTANT || part.getToken() == Token.FORMATTED_VALUE;
  }

  /** Builds the replacement field {@code {value}} of an f-string. */
  public static Node formattedValue(Node value) {
    return formattedValue(value, null, empty());
  }

  /**
   * Builds {@code {value!conversion:formatSpec}}.
   *
   * @param conversion {@code r}, {@code s}, {@code a} or null
   * @param formatSpec a {@link Token#JOINED_STR} or {@link #empty()}
   */
  public static Node formattedValue(Node value, @Nullable String conversion, Node formatSpec) {
    checkArgument(
        conversion == null || isConversion(conversion), "bad conversion: %s", conversion);
    checkState(formatSpec.isEmpty() || formatSpec.getToken() == Token.JOINED_STR, formatSpec);
    Node n = new Node(Token.FORMATTED_VALUE, value, formatSpec);
    if (conversion != null) {
      n.setString(conversion);
    }
    return n;
  }

  static boolean isConversion(String conversion) {
    return conversion.equals("r") || conversion.equals("s") || conversion.equals("a");
  }

  /** Builds a literal from its source text, e.g. {@code 1}, {@code 'abc'} or {@code None}. */
  public static Node constant(String sourceText) {
    return Node.newString(Token.CONSTANT, sourceText);
  }

  public static Node number(long value) {
    return constant(Long.toString(value));
  }

  // ==========================================================================
  // Helpers

  /**
   * Marks a target with the given context. Sequences and starred targets are marked recursively;
   * the value of an attribute or subscript target keeps its load context. Nodes that cannot be
   * targets are left untouched.
   */
  private static Node asTarget(Node target, ExprContext context) {
    switch (target.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        target.putProp(Node.Prop.CONTEXT, context);
        break;
      case TUPLE:
      case LIST:
      case STARRED:
        target.putProp(Node.Prop.CONTEXT, context);
        for (Node child : target.children()) {
          asTarget(child, context);
        }
        break;
      default:
        break;
    }
    return target;
  }
}
