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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AstValidatorTest {

  private final List<String> violations = new ArrayList<>();

  private void expectValid(Node module) {
    new AstValidator().validateModule(module);
  }

  private String expectInvalid(Node module) {
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> new AstValidator().validateModule(module));
    return e.getMessage();
  }

  @Test
  public void testTreesBuiltWithIrAreValid() {
    expectValid(
        IR.module(
            IR.importFrom("pkg", IR.alias("a", "b")),
            IR.classDef(
                "C",
                IR.bases(IR.name("Base"), IR.keyword("metaclass", IR.name("Meta"))),
                IR.block(
                    IR.functionDef(
                        "m",
                        IR.decorators(IR.name("staticmethod")),
                        IR.paramList(
                            IR.param("x", ParamKind.POSITIONAL, IR.name("int"), IR.number(0))),
                        IR.empty(),
                        IR.block(IR.returnNode(IR.lambda(IR.paramList("y"), IR.name("y"))))))),
            IR.forNode(
                IR.tuple(IR.name("k"), IR.name("v")),
                IR.call(IR.attribute(IR.name("d"), "items")),
                IR.block(
                    IR.augAssign("+", IR.subscript(IR.name("t"), IR.name("k")), IR.name("v")))),
            IR.with(
                IR.withItem(IR.call(IR.name("open"), IR.name("p")), IR.name("f")),
                IR.block(IR.delete(IR.name("f")))),
            IR.tryNode(
                IR.block(IR.raise(IR.name("E"))),
                ImmutableList.of(IR.exceptHandler(IR.empty(), null, IR.block(IR.pass()))),
                IR.block(),
                IR.block(IR.global("g"))),
            IR.exprStmt(
                IR.dictComp(
                    IR.name("k"),
                    IR.joinedStr(
                        IR.constant("v="), IR.formattedValue(IR.name("v"), "r", IR.empty())),
                    IR.comprehension(
                        IR.name("k"), IR.name("ks"), IR.namedExpr(IR.name("m"), IR.name("k"))))),
            IR.exprStmt(
                IR.subscript(IR.name("xs"), IR.slice(IR.empty(), IR.number(2), IR.empty())))));
  }

  @Test
  public void testFunctionWithoutChildren() {
    Node module = IR.module(Node.newString(Token.FUNCTION_DEF, "f"));
    assertThat(expectInvalid(module)).contains("Expected 4 children, but was 0");
  }

  @Test
  public void testParamOutsideParameterList() {
    Node module = IR.module(IR.exprStmt(IR.param("p")));
    assertThat(expectInvalid(module)).contains("Expected an expression but was PARAM");
  }

  @Test
  public void testExpressionInStatementPosition() {
    assertThat(expectInvalid(IR.module(IR.name("x"))))
        .contains("Expected a statement but was NAME");
  }

  @Test
  public void testMissingString() {
    Node module = IR.module(IR.exprStmt(new Node(Token.NAME)));
    assertThat(expectInvalid(module)).contains("NAME without its string");
  }

  @Test
  public void testImportOfNonAlias() {
    Node module = IR.module(new Node(Token.IMPORT, IR.name("os")));
    assertThat(expectInvalid(module)).contains("Expected ALIAS but was NAME");
  }

  @Test
  public void testWrongBlock() {
    Node module =
        IR.module(new Node(Token.WHILE, IR.name("c"), IR.exprStmt(IR.name("x")), IR.block()));
    assertThat(expectInvalid(module)).contains("Expected BLOCK but was EXPR_STMT");
  }

  @Test
  public void testComprehensionWithoutClause() {
    Node module = IR.module(IR.exprStmt(new Node(Token.LIST_COMP, IR.name("x"))));
    assertThat(expectInvalid(module)).contains("Expected at least 2 children, but was 1");
  }

  @Test
  public void testBadFormattedStringPart() {
    Node module = IR.module(IR.exprStmt(new Node(Token.JOINED_STR, IR.name("x"))));
    assertThat(expectInvalid(module)).contains("Expected an f-string part but was NAME");
  }

  @Test
  public void testOddDict() {
    Node module = IR.module(IR.exprStmt(new Node(Token.DICT, IR.name("k"))));
    assertThat(expectInvalid(module)).contains("Expected key/value pairs");
  }

  @Test
  public void testHandlerReceivesViolation() {
    AstValidator validator =
        new AstValidator(
            (message, n) -> {
              violations.add(message + " at " + n.getToken());
              throw new IllegalArgumentException(message);
            });
    assertThrows(
        IllegalArgumentException.class,
        () -> validator.validateModule(IR.module(new Node(Token.RETURN))));
    assertThat(violations).containsExactly("Expected 1 children, but was 0 at RETURN");
  }

  @Test
  public void testRootMustBeModule() {
    assertThrows(
        IllegalStateException.class, () -> new AstValidator().validateModule(IR.block()));
  }
}
