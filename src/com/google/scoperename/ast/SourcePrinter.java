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

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints a syntax tree as Python-like source text.
 *
 * <p>The output is meant for humans and tests: every statement goes on its own line, blocks are
 * indented by four spaces, tuples are always parenthesized and every operator expression nested
 * in another expression is parenthesized, so the printer needs no precedence table.
 */
public final class SourcePrinter {

  private static final String INDENT = "    ";

  private final StringBuilder sb = new StringBuilder();
  private int indent;

  private SourcePrinter() {}

  /** Prints a MODULE, a BLOCK, a single statement or an expression. */
  public static String print(Node n) {
    SourcePrinter printer = new SourcePrinter();
    switch (n.getToken()) {
      case MODULE:
      case BLOCK:
        for (Node statement : n.children()) {
          printer.statement(statement);
        }
        break;
      default:
        if (isStatement(n)) {
          printer.statement(n);
        } else {
          printer.expr(n);
        }
        break;
    }
    return printer.sb.toString();
  }

  private static boolean isStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
      case CLASS_DEF:
      case ASSIGN:
      case ANN_ASSIGN:
      case AUG_ASSIGN:
      case FOR:
      case WHILE:
      case IF:
      case WITH:
      case TRY:
      case IMPORT:
      case IMPORT_FROM:
      case GLOBAL:
      case NONLOCAL:
      case RETURN:
      case EXPR_STMT:
      case RAISE:
      case DELETE:
      case ASSERT:
      case PASS:
      case BREAK:
      case CONTINUE:
        return true;
      default:
        return false;
    }
  }

  // ==========================================================================
  // Statements

  private void line(String text) {
    sb.append(Strings.repeat(INDENT, indent)).append(text).append('\n');
  }

  private void suite(String header, Node block) {
    line(header + ":");
    indent++;
    if (block.hasChildren()) {
      for (Node statement : block.children()) {
        statement(statement);
      }
    } else {
      line("pass");
    }
    indent--;
  }

  private void optionalSuite(String header, Node block) {
    if (block.hasChildren()) {
      suite(header, block);
    }
  }

  private void statement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        {
          Node decorators = n.getFirstChild();
          Node params = decorators.getNext();
          Node returns = params.getNext();
          printDecorators(decorators);
          String header =
              (n.getBooleanProp(Node.Prop.ASYNC) ? "async def " : "def ")
                  + n.getString()
                  + "("
                  + paramsToString(params, true)
                  + ")"
                  + (returns.isEmpty() ? "" : " -> " + exprToString(returns));
          suite(header, returns.getNext());
          break;
        }
      case CLASS_DEF:
        {
          Node decorators = n.getFirstChild();
          Node bases = decorators.getNext();
          printDecorators(decorators);
          String header = "class " + n.getString();
          if (bases.hasChildren()) {
            header += "(" + joinExprs(bases.children()) + ")";
          }
          suite(header, bases.getNext());
          break;
        }
      case ASSIGN:
        {
          StringBuilder text = new StringBuilder();
          for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
            text.append(exprToString(child));
            if (child.getNext() != null) {
              text.append(" = ");
            }
          }
          line(text.toString());
          break;
        }
      case ANN_ASSIGN:
        {
          Node target = n.getFirstChild();
          Node annotation = target.getNext();
          Node value = annotation.getNext();
          line(
              exprToString(target)
                  + ": "
                  + exprToString(annotation)
                  + (value.isEmpty() ? "" : " = " + exprToString(value)));
          break;
        }
      case AUG_ASSIGN:
        line(
            exprToString(n.getFirstChild())
                + " "
                + n.getString()
                + "= "
                + exprToString(n.getLastChild()));
        break;
      case FOR:
        {
          Node target = n.getFirstChild();
          Node iterable = target.getNext();
          Node body = iterable.getNext();
          suite(
              (n.getBooleanProp(Node.Prop.ASYNC) ? "async for " : "for ")
                  + exprToString(target)
                  + " in "
                  + exprToString(iterable),
              body);
          optionalSuite("else", body.getNext());
          break;
        }
      case WHILE:
        {
          Node body = n.getFirstChild().getNext();
          suite("while " + exprToString(n.getFirstChild()), body);
          optionalSuite("else", body.getNext());
          break;
        }
      case IF:
        {
          Node then = n.getFirstChild().getNext();
          suite("if " + exprToString(n.getFirstChild()), then);
          optionalSuite("else", then.getNext());
          break;
        }
      case WITH:
        {
          List<String> items = new ArrayList<>();
          for (Node item = n.getFirstChild(); item != n.getLastChild(); item = item.getNext()) {
            Node target = item.getLastChild();
            items.add(
                exprToString(item.getFirstChild())
                    + (target.isEmpty() ? "" : " as " + exprToString(target)));
          }
          suite(
              (n.getBooleanProp(Node.Prop.ASYNC) ? "async with " : "with ")
                  + String.join(", ", items),
              n.getLastChild());
          break;
        }
      case TRY:
        {
          suite("try", n.getFirstChild());
          Node child = n.getFirstChild().getNext();
          for (; child.getToken() == Token.EXCEPT_HANDLER; child = child.getNext()) {
            Node type = child.getFirstChild();
            String header = "except";
            if (!type.isEmpty()) {
              header += " " + exprToString(type);
            }
            if (child.hasString()) {
              header += " as " + child.getString();
            }
            suite(header, child.getLastChild());
          }
          optionalSuite("else", child);
          optionalSuite("finally", child.getNext());
          break;
        }
      case IMPORT:
        line("import " + aliasesToString(n));
        break;
      case IMPORT_FROM:
        line(
            "from "
                + Strings.repeat(".", n.getIntProp(Node.Prop.LEVEL))
                + Strings.nullToEmpty(n.getStringOrNull())
                + " import "
                + aliasesToString(n));
        break;
      case GLOBAL:
        line("global " + joinExprs(n.children()));
        break;
      case NONLOCAL:
        line("nonlocal " + joinExprs(n.children()));
        break;
      case RETURN:
        line(n.getFirstChild().isEmpty() ? "return" : "return " + exprToString(n.getFirstChild()));
        break;
      case EXPR_STMT:
        line(exprToString(n.getFirstChild()));
        break;
      case RAISE:
        {
          Node exception = n.getFirstChild();
          Node cause = exception.getNext();
          String text = exception.isEmpty() ? "raise" : "raise " + exprToString(exception);
          line(cause.isEmpty() ? text : text + " from " + exprToString(cause));
          break;
        }
      case DELETE:
        line("del " + joinExprs(n.children()));
        break;
      case ASSERT:
        {
          Node message = n.getLastChild();
          line(
              "assert "
                  + exprToString(n.getFirstChild())
                  + (message.isEmpty() ? "" : ", " + exprToString(message)));
          break;
        }
      case PASS:
        line("pass");
        break;
      case BREAK:
        line("break");
        break;
      case CONTINUE:
        line("continue");
        break;
      default:
        throw new IllegalArgumentException("Not a statement: " + n);
    }
  }

  private void printDecorators(Node decorators) {
    for (Node decorator : decorators.children()) {
      line("@" + exprToString(decorator));
    }
  }

  private static String aliasesToString(Node importNode) {
    List<String> parts = new ArrayList<>();
    for (Node alias : importNode.children()) {
      String asName = alias.getAsName();
      parts.add(asName == null ? alias.getString() : alias.getString() + " as " + asName);
    }
    return String.join(", ", parts);
  }

  // ==========================================================================
  // Expressions

  private static String exprToString(Node n) {
    SourcePrinter printer = new SourcePrinter();
    printer.expr(n);
    return printer.sb.toString();
  }

  private static String joinExprs(Iterable<Node> nodes) {
    List<String> parts = new ArrayList<>();
    for (Node n : nodes) {
      parts.add(exprToString(n));
    }
    return String.join(", ", parts);
  }

  private static String paramsToString(Node params, boolean withAnnotations) {
    List<String> parts = new ArrayList<>();
    boolean sawStar = false;
    for (Node param = params.getFirstChild(); param != null; param = param.getNext()) {
      ParamKind kind = param.getParamKind();
      Node annotation = param.getFirstChild();
      Node defaultValue = annotation.getNext();
      String prefix = "";
      if (kind == ParamKind.VARARG) {
        prefix = "*";
        sawStar = true;
      } else if (kind == ParamKind.KWARG) {
        prefix = "**";
      } else if (kind == ParamKind.KEYWORD_ONLY && !sawStar) {
        parts.add("*");
        sawStar = true;
      }
      String text = prefix + param.getString();
      boolean annotated = withAnnotations && !annotation.isEmpty();
      if (annotated) {
        text += ": " + exprToString(annotation);
      }
      if (!defaultValue.isEmpty()) {
        text += (annotated ? " = " : "=") + exprToString(defaultValue);
      }
      parts.add(text);
      Node next = param.getNext();
      if (kind == ParamKind.POSITIONAL_ONLY
          && (next == null || next.getParamKind() != ParamKind.POSITIONAL_ONLY)) {
        parts.add("/");
      }
    }
    return String.join(", ", parts);
  }

  private void operand(Node n) {
    if (isOperator(n)) {
      sb.append('(');
      expr(n);
      sb.append(')');
    } else {
      expr(n);
    }
  }

  private static boolean isOperator(Node n) {
    switch (n.getToken()) {
      case BIN_OP:
      case UNARY_OP:
      case BOOL_OP:
      case COMPARE:
      case IF_EXP:
      case LAMBDA:
      case AWAIT:
      case YIELD:
        return true;
      default:
        return false;
    }
  }

  private void expr(Node n) {
    switch (n.getToken()) {
      case NAME:
      case CONSTANT:
        sb.append(n.getString());
        break;
      case ATTRIBUTE:
        operand(n.getFirstChild());
        sb.append('.').append(n.getString());
        break;
      case SUBSCRIPT:
        operand(n.getFirstChild());
        sb.append('[');
        expr(n.getLastChild());
        sb.append(']');
        break;
      case SLICE:
        {
          Node lower = n.getFirstChild();
          Node upper = lower.getNext();
          Node step = upper.getNext();
          if (!lower.isEmpty()) {
            operand(lower);
          }
          sb.append(':');
          if (!upper.isEmpty()) {
            operand(upper);
          }
          if (!step.isEmpty()) {
            sb.append(':');
            operand(step);
          }
          break;
        }
      case STARRED:
        sb.append('*');
        operand(n.getFirstChild());
        break;
      case TUPLE:
        sb.append('(').append(joinExprs(n.children()));
        if (n.getChildCount() == 1) {
          sb.append(',');
        }
        sb.append(')');
        break;
      case LIST:
        sb.append('[').append(joinExprs(n.children())).append(']');
        break;
      case SET:
        checkArgument(n.hasChildren(), "empty set display");
        sb.append('{').append(joinExprs(n.children())).append('}');
        break;
      case DICT:
        {
          sb.append('{');
          for (Node key = n.getFirstChild(); key != null; key = key.getNext().getNext()) {
            Node value = key.getNext();
            if (key.isEmpty()) {
              sb.append("**");
              operand(value);
            } else {
              expr(key);
              sb.append(": ");
              expr(value);
            }
            if (value.getNext() != null) {
              sb.append(", ");
            }
          }
          sb.append('}');
          break;
        }
      case CALL:
        {
          operand(n.getFirstChild());
          List<String> arguments = new ArrayList<>();
          for (Node arg = n.getFirstChild().getNext(); arg != null; arg = arg.getNext()) {
            arguments.add(exprToString(arg));
          }
          sb.append('(').append(String.join(", ", arguments)).append(')');
          break;
        }
      case KEYWORD:
        if (n.hasString()) {
          sb.append(n.getString()).append('=');
        } else {
          sb.append("**");
        }
        expr(n.getFirstChild());
        break;
      case BIN_OP:
      case COMPARE:
        operand(n.getFirstChild());
        sb.append(' ').append(n.getString()).append(' ');
        operand(n.getLastChild());
        break;
      case BOOL_OP:
        for (Node operand = n.getFirstChild(); operand != null; operand = operand.getNext()) {
          operand(operand);
          if (operand.getNext() != null) {
            sb.append(' ').append(n.getString()).append(' ');
          }
        }
        break;
      case UNARY_OP:
        sb.append(n.getString());
        if (Character.isLetter(n.getString().charAt(n.getString().length() - 1))) {
          sb.append(' ');
        }
        operand(n.getFirstChild());
        break;
      case IF_EXP:
        operand(n.getChildAtIndex(1));
        sb.append(" if ");
        operand(n.getFirstChild());
        sb.append(" else ");
        operand(n.getLastChild());
        break;
      case LAMBDA:
        {
          String params = paramsToString(n.getFirstChild(), false);
          sb.append(params.isEmpty() ? "lambda: " : "lambda " + params + ": ");
          expr(n.getLastChild());
          break;
        }
      case AWAIT:
        sb.append("await ");
        operand(n.getFirstChild());
        break;
      case YIELD:
        sb.append("yield");
        if (!n.getFirstChild().isEmpty()) {
          sb.append(' ');
          expr(n.getFirstChild());
        }
        break;
      case NAMED_EXPR:
        sb.append('(');
        expr(n.getFirstChild());
        sb.append(" := ");
        expr(n.getLastChild());
        sb.append(')');
        break;
      case JOINED_STR:
        sb.append("f'");
        joinedStrParts(n);
        sb.append('\'');
        break;
      case LIST_COMP:
        comprehension("[", n, 1, "]");
        break;
      case SET_COMP:
        comprehension("{", n, 1, "}");
        break;
      case GENERATOR_EXP:
        comprehension("(", n, 1, ")");
        break;
      case DICT_COMP:
        comprehension("{", n, 2, "}");
        break;
      default:
        throw new IllegalArgumentException("Not an expression: " + n);
    }
  }

  private void joinedStrParts(Node joinedStr) {
    for (Node part : joinedStr.children()) {
      if (part.getToken() == Token.CONSTANT) {
        appendLiteralText(part.getString());
        continue;
      }
      checkArgument(part.getToken() == Token.FORMATTED_VALUE, "Not an f-string part: %s", part);
      String value = exprToString(part.getFirstChild());
      // "{{" would read as an escaped brace.
      sb.append(value.startsWith("{") ? "{ " : "{").append(value);
      if (part.hasString()) {
        sb.append('!').append(part.getString());
      }
      Node formatSpec = part.getLastChild();
      if (!formatSpec.isEmpty()) {
        sb.append(':');
        joinedStrParts(formatSpec);
      }
      sb.append('}');
    }
  }

  private void appendLiteralText(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '{' -> sb.append("{{");
        case '}' -> sb.append("}}");
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
  }

  private void comprehension(String open, Node n, int elementCount, String close) {
    sb.append(open);
    expr(n.getFirstChild());
    if (elementCount == 2) {
      sb.append(": ");
      expr(n.getChildAtIndex(1));
    }
    for (Node clause = n.getChildAtIndex(elementCount);
        clause != null;
        clause = clause.getNext()) {
      Node target = clause.getFirstChild();
      Node iterable = target.getNext();
      sb.append(clause.getBooleanProp(Node.Prop.ASYNC) ? " async for " : " for ");
      expr(target);
      sb.append(" in ");
      operand(iterable);
      for (Node condition = iterable.getNext();
          condition != null;
          condition = condition.getNext()) {
        sb.append(" if ");
        operand(condition);
      }
    }
    sb.append(close);
  }
}
