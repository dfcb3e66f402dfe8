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
 * Checks that a tree has the child layout {@link IR} builds, so passes can walk it without
 * checking shapes themselves. Trees built with {@link IR} always pass; trees read from outside
 * should be validated first.
 */
public final class AstValidator {

  /** Receives layout violations. Validation does not go on past a violation, so it must throw. */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  /** A validator that throws {@link IllegalStateException} on the first violation. */
  public AstValidator() {
    this(
        (message, n) -> {
          throw new IllegalStateException(message + ". Reference node:\n" + n.toStringTree());
        });
  }

  public void validateModule(Node n) {
    validateNodeType(Token.MODULE, n);
    validateStatements(n);
  }

  private void validateStatements(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateStatement(c);
    }
  }

  private void validateBlock(Node n) {
    validateNodeType(Token.BLOCK, n);
    validateStatements(n);
  }

  private void validateStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        validateHasString(n);
        validateChildCount(n, 4);
        validateDecorators(n.getFirstChild());
        validateParamList(n.getChildAtIndex(1));
        validateOptionalExpression(n.getChildAtIndex(2));
        validateBlock(n.getLastChild());
        return;
      case CLASS_DEF:
        validateHasString(n);
        validateChildCount(n, 3);
        validateDecorators(n.getFirstChild());
        validateBases(n.getChildAtIndex(1));
        validateBlock(n.getLastChild());
        return;
      case ASSIGN:
        validateMinimumChildCount(n, 2);
        validateExpressions(n);
        return;
      case ANN_ASSIGN:
        validateChildCount(n, 3);
        validateExpression(n.getFirstChild());
        validateExpression(n.getChildAtIndex(1));
        validateOptionalExpression(n.getLastChild());
        return;
      case AUG_ASSIGN:
        validateHasString(n);
        validateChildCount(n, 2);
        validateExpressions(n);
        return;
      case FOR:
        validateChildCount(n, 4);
        validateExpression(n.getFirstChild());
        validateExpression(n.getChildAtIndex(1));
        validateBlock(n.getChildAtIndex(2));
        validateBlock(n.getLastChild());
        return;
      case WHILE:
      case IF:
        validateChildCount(n, 3);
        validateExpression(n.getFirstChild());
        validateBlock(n.getChildAtIndex(1));
        validateBlock(n.getLastChild());
        return;
      case WITH:
        validateWith(n);
        return;
      case TRY:
        validateTry(n);
        return;
      case IMPORT:
      case IMPORT_FROM:
        validateMinimumChildCount(n, 1);
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateNodeType(Token.ALIAS, c);
          validateHasString(c);
          validateChildCount(c, 0);
        }
        return;
      case GLOBAL:
      case NONLOCAL:
        validateMinimumChildCount(n, 1);
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateNodeType(Token.NAME, c);
          validateExpression(c);
        }
        return;
      case RETURN:
        validateChildCount(n, 1);
        validateOptionalExpression(n.getFirstChild());
        return;
      case EXPR_STMT:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case RAISE:
        validateChildCount(n, 2);
        validateOptionalExpression(n.getFirstChild());
        validateOptionalExpression(n.getLastChild());
        return;
      case DELETE:
        validateMinimumChildCount(n, 1);
        validateExpressions(n);
        return;
      case ASSERT:
        validateChildCount(n, 2);
        validateExpression(n.getFirstChild());
        validateOptionalExpression(n.getLastChild());
        return;
      case PASS:
      case BREAK:
      case CONTINUE:
        validateChildCount(n, 0);
        return;
      default:
        violation("Expected a statement but was " + n.getToken(), n);
    }
  }

  private void validateWith(Node n) {
    validateMinimumChildCount(n, 2);
    Node body = n.getLastChild();
    for (Node item = n.getFirstChild(); item != body; item = item.getNext()) {
      validateNodeType(Token.WITH_ITEM, item);
      validateChildCount(item, 2);
      validateExpression(item.getFirstChild());
      validateOptionalExpression(item.getLastChild());
    }
    validateBlock(body);
  }

  private void validateTry(Node n) {
    validateMinimumChildCount(n, 3);
    validateBlock(n.getFirstChild());
    Node orElse = n.getChildAtIndex(n.getChildCount() - 2);
    for (Node handler = n.getFirstChild().getNext();
        handler != orElse;
        handler = handler.getNext()) {
      validateNodeType(Token.EXCEPT_HANDLER, handler);
      validateChildCount(handler, 2);
      validateOptionalExpression(handler.getFirstChild());
      validateBlock(handler.getLastChild());
    }
    validateBlock(orElse);
    validateBlock(n.getLastChild());
  }

  private void validateDecorators(Node n) {
    validateNodeType(Token.DECORATORS, n);
    validateExpressions(n);
  }

  private void validateBases(Node n) {
    validateNodeType(Token.BASES, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateArgument(c);
    }
  }

  private void validateParamList(Node n) {
    validateNodeType(Token.PARAM_LIST, n);
    for (Node param = n.getFirstChild(); param != null; param = param.getNext()) {
      validateNodeType(Token.PARAM, param);
      validateHasString(param);
      validateChildCount(param, 2);
      validateOptionalExpression(param.getFirstChild());
      validateOptionalExpression(param.getLastChild());
    }
  }

  private void validateExpressions(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateExpression(c);
    }
  }

  private void validateOptionalExpression(Node n) {
    if (!n.isEmpty()) {
      validateExpression(n);
    } else {
      validateChildCount(n, 0);
    }
  }

  /** A positional argument, a starred argument or a keyword argument of a call. */
  private void validateArgument(Node n) {
    if (n.isKeyword()) {
      validateChildCount(n, 1);
      validateExpression(n.getFirstChild());
    } else {
      validateExpression(n);
    }
  }

  private void validateExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case CONSTANT:
        validateHasString(n);
        validateChildCount(n, 0);
        return;
      case ATTRIBUTE:
        validateHasString(n);
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case SUBSCRIPT:
        validateChildCount(n, 2);
        validateExpression(n.getFirstChild());
        if (n.getLastChild().getToken() == Token.SLICE) {
          validateChildCount(n.getLastChild(), 3);
          validateOptionalExpressions(n.getLastChild());
        } else {
          validateExpression(n.getLastChild());
        }
        return;
      case STARRED:
      case AWAIT:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case YIELD:
        validateChildCount(n, 1);
        validateOptionalExpression(n.getFirstChild());
        return;
      case TUPLE:
      case LIST:
      case SET:
        validateExpressions(n);
        return;
      case DICT:
        if (n.getChildCount() % 2 != 0) {
          violation("Expected key/value pairs, but was " + n.getChildCount() + " children", n);
        }
        for (Node key = n.getFirstChild(); key != null; key = key.getNext().getNext()) {
          validateOptionalExpression(key);
          if (key.getNext() == null) {
            return;
          }
          validateExpression(key.getNext());
        }
        return;
      case CALL:
        validateMinimumChildCount(n, 1);
        validateExpression(n.getFirstChild());
        for (Node arg = n.getFirstChild().getNext(); arg != null; arg = arg.getNext()) {
          validateArgument(arg);
        }
        return;
      case BIN_OP:
      case COMPARE:
        validateHasString(n);
        validateChildCount(n, 2);
        validateExpressions(n);
        return;
      case UNARY_OP:
        validateHasString(n);
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case BOOL_OP:
        validateHasString(n);
        validateMinimumChildCount(n, 2);
        validateExpressions(n);
        return;
      case IF_EXP:
        validateChildCount(n, 3);
        validateExpressions(n);
        return;
      case LAMBDA:
        validateChildCount(n, 2);
        validateParamList(n.getFirstChild());
        validateExpression(n.getLastChild());
        return;
      case NAMED_EXPR:
        validateChildCount(n, 2);
        validateExpressions(n);
        return;
      case JOINED_STR:
        validateJoinedStr(n);
        return;
      case LIST_COMP:
      case SET_COMP:
      case GENERATOR_EXP:
        validateComprehension(n, 1);
        return;
      case DICT_COMP:
        validateComprehension(n, 2);
        return;
      default:
        violation("Expected an expression but was " + n.getToken(), n);
    }
  }

  private void validateOptionalExpressions(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateOptionalExpression(c);
    }
  }

  private void validateJoinedStr(Node n) {
    for (Node part = n.getFirstChild(); part != null; part = part.getNext()) {
      if (!IR.isJoinedStrPart(part)) {
        violation("Expected an f-string part but was " + part.getToken(), part);
      } else if (part.getToken() == Token.CONSTANT) {
        validateHasString(part);
        validateChildCount(part, 0);
      } else {
        validateChildCount(part, 2);
        if (part.hasString() && !IR.isConversion(part.getString())) {
          violation("Unknown conversion " + part.getString(), part);
        }
        validateExpression(part.getFirstChild());
        Node formatSpec = part.getLastChild();
        if (formatSpec.isEmpty()) {
          validateChildCount(formatSpec, 0);
        } else {
          validateNodeType(Token.JOINED_STR, formatSpec);
          validateJoinedStr(formatSpec);
        }
      }
    }
  }

  private void validateComprehension(Node n, int elementCount) {
    validateMinimumChildCount(n, elementCount + 1);
    Node generator = n.getFirstChild();
    for (int i = 0; i < elementCount; i++) {
      validateExpression(generator);
      generator = generator.getNext();
    }
    for (; generator != null; generator = generator.getNext()) {
      validateNodeType(Token.COMPREHENSION, generator);
      validateMinimumChildCount(generator, 2);
      validateExpressions(generator);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateHasString(Node n) {
    if (!n.hasString()) {
      violation(n.getToken() + " without its string", n);
    }
  }

  private void validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
    }
  }

  private void validateMinimumChildCount(Node n, int i) {
    if (n.getChildCount() < i) {
      violation("Expected at least " + i + " children, but was " + n.getChildCount(), n);
    }
  }
}
