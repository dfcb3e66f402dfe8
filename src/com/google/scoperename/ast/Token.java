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

/**
 * The closed set of syntax tree node kinds.
 *
 * <p>Every {@link Node} carries exactly one token. Passes dispatch on it with a {@code switch};
 * see {@link IR} for the child layout each token expects.
 */
public enum Token {
  // Roots and statement containers.
  MODULE,
  BLOCK,

  // Definitions.
  FUNCTION_DEF,
  LAMBDA,
  CLASS_DEF,
  DECORATORS,
  BASES,
  PARAM_LIST,
  PARAM,

  // Statements.
  ASSIGN,
  ANN_ASSIGN,
  AUG_ASSIGN,
  FOR,
  WHILE,
  IF,
  WITH,
  WITH_ITEM,
  TRY,
  EXCEPT_HANDLER,
  IMPORT,
  IMPORT_FROM,
  ALIAS,
  GLOBAL,
  NONLOCAL,
  RETURN,
  EXPR_STMT,
  RAISE,
  DELETE,
  ASSERT,
  PASS,
  BREAK,
  CONTINUE,

  // Expressions.
  NAME,
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
  LIST_COMP,
  SET_COMP,
  GENERATOR_EXP,
  DICT_COMP,
  COMPREHENSION,
  NAMED_EXPR,
  JOINED_STR,
  FORMATTED_VALUE,
  CONSTANT,

  // Placeholder for an absent optional child.
  EMPTY;

  /** Whether nodes of this kind carry a string payload (identifier, operator or literal). */
  public boolean hasString() {
    switch (this) {
      case FUNCTION_DEF:
      case CLASS_DEF:
      case PARAM:
      case AUG_ASSIGN:
      case EXCEPT_HANDLER:
      case IMPORT_FROM:
      case ALIAS:
      case NAME:
      case ATTRIBUTE:
      case KEYWORD:
      case FORMATTED_VALUE:
      case BIN_OP:
      case UNARY_OP:
      case BOOL_OP:
      case COMPARE:
      case CONSTANT:
        return true;
      default:
        return false;
    }
  }
}
