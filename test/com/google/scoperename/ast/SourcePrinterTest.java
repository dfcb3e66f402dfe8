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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourcePrinterTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void testFunctionDef() {
    Node param = IR.param("x", ParamKind.POSITIONAL, IR.name("int"), IR.number(0));
    Node fn =
        IR.functionDef(
            "f",
            IR.decorators(IR.name("cached")),
            IR.paramList(
                param,
                IR.param("args", ParamKind.VARARG),
                IR.param("key", ParamKind.KEYWORD_ONLY),
                IR.param("kw", ParamKind.KWARG)),
            IR.name("int"),
            IR.block(IR.returnNode(IR.name("x"))));
    assertThat(SourcePrinter.print(IR.module(fn)))
        .isEqualTo(
            lines(
                "@cached",
                "def f(x: int = 0, *args, key, **kw) -> int:",
                "    return x"));
  }

  @Test
  public void testBareKeywordOnlyMarker() {
    Node fn =
        IR.functionDef(
            "f",
            IR.paramList(
                IR.param("a", ParamKind.POSITIONAL_ONLY), IR.param("b", ParamKind.KEYWORD_ONLY)),
            IR.block());
    assertThat(SourcePrinter.print(fn)).isEqualTo(lines("def f(a, /, *, b):", "    pass"));
  }

  @Test
  public void testClassDef() {
    Node cls =
        IR.classDef(
            "C",
            IR.bases(IR.name("Base")),
            IR.block(IR.assign(IR.name("x"), IR.number(1))));
    assertThat(SourcePrinter.print(cls)).isEqualTo(lines("class C(Base):", "    x = 1"));
  }

  @Test
  public void testAssignments() {
    Node module =
        IR.module(
            IR.assign(ImmutableList.of(IR.name("a"), IR.name("b")), IR.number(0)),
            IR.assign(IR.tuple(IR.name("c"), IR.starred(IR.name("d"))), IR.name("e")),
            IR.annAssign(IR.name("f"), IR.name("int"), IR.empty()),
            IR.augAssign("+", IR.attribute(IR.name("g"), "h"), IR.number(2)));
    assertThat(SourcePrinter.print(module))
        .isEqualTo(lines("a = b = 0", "(c, *d) = e", "f: int", "g.h += 2"));
  }

  @Test
  public void testLoopsAndConditionals() {
    Node module =
        IR.module(
            IR.forNode(
                IR.name("i"),
                IR.call(IR.name("range"), IR.number(3)),
                IR.block(
                    IR.ifNode(
                        IR.compare("==", IR.name("i"), IR.number(1)),
                        IR.block(IR.breakNode()))),
                IR.block(IR.pass())),
            IR.whileNode(IR.name("running"), IR.block(IR.continueNode())));
    assertThat(SourcePrinter.print(module))
        .isEqualTo(
            lines(
                "for i in range(3):",
                "    if i == 1:",
                "        break",
                "else:",
                "    pass",
                "while running:",
                "    continue"));
  }

  @Test
  public void testWithAndTry() {
    Node module =
        IR.module(
            IR.with(
                ImmutableList.of(
                    IR.withItem(IR.call(IR.name("open"), IR.name("p")), IR.name("f")),
                    IR.withItem(IR.name("lock"))),
                IR.block(IR.exprStmt(IR.call(IR.attribute(IR.name("f"), "read"))))),
            IR.tryNode(
                IR.block(IR.raise(IR.name("E"), IR.name("cause"))),
                ImmutableList.of(
                    IR.exceptHandler(IR.name("E"), "e", IR.block(IR.pass())),
                    IR.exceptHandler(IR.empty(), null, IR.block(IR.raise(IR.empty())))),
                IR.block(),
                IR.block(IR.exprStmt(IR.call(IR.name("done"))))));
    assertThat(SourcePrinter.print(module))
        .isEqualTo(
            lines(
                "with open(p) as f, lock:",
                "    f.read()",
                "try:",
                "    raise E from cause",
                "except E as e:",
                "    pass",
                "except:",
                "    raise",
                "finally:",
                "    done()"));
  }

  @Test
  public void testImportsAndDeclarations() {
    Node module =
        IR.module(
            IR.importNode(IR.alias("os.path"), IR.alias("numpy", "np")),
            IR.importFrom("pkg", 2, IR.alias("mod")),
            IR.importFrom(null, 1, IR.alias("sibling")),
            IR.global("a", "b"),
            IR.nonlocal("c"),
            IR.delete(IR.name("a"), IR.subscript(IR.name("d"), IR.constant("'k'"))),
            IR.assertNode(IR.name("ok"), IR.constant("'msg'")));
    assertThat(SourcePrinter.print(module))
        .isEqualTo(
            lines(
                "import os.path, numpy as np",
                "from ..pkg import mod",
                "from . import sibling",
                "global a, b",
                "nonlocal c",
                "del a, d['k']",
                "assert ok, 'msg'"));
  }

  @Test
  public void testNestedOperatorsAreParenthesized() {
    Node expr =
        IR.binOp(
            "*",
            IR.binOp("+", IR.name("a"), IR.name("b")),
            IR.unaryOp("not", IR.boolOp("or", IR.name("c"), IR.name("d"))));
    assertThat(SourcePrinter.print(expr)).isEqualTo("(a + b) * (not (c or d))");
  }

  @Test
  public void testCallArgumentsAreNotParenthesized() {
    Node call =
        IR.call(
            IR.attribute(IR.binOp("+", IR.name("a"), IR.name("b")), "real"),
            IR.binOp("-", IR.name("x"), IR.number(1)),
            IR.keyword("key", IR.name("k")),
            IR.keyword(null, IR.name("kw")),
            IR.starred(IR.name("rest")));
    assertThat(SourcePrinter.print(call)).isEqualTo("(a + b).real(x - 1, key=k, **kw, *rest)");
  }

  @Test
  public void testCollections() {
    assertThat(SourcePrinter.print(IR.tuple(IR.name("a")))).isEqualTo("(a,)");
    assertThat(SourcePrinter.print(IR.tuple())).isEqualTo("()");
    assertThat(SourcePrinter.print(IR.list(IR.name("a"), IR.name("b")))).isEqualTo("[a, b]");
    assertThat(SourcePrinter.print(IR.set(IR.number(1)))).isEqualTo("{1}");
    assertThat(
            SourcePrinter.print(
                IR.dict(IR.constant("'a'"), IR.number(1), IR.empty(), IR.name("other"))))
        .isEqualTo("{'a': 1, **other}");
    assertThat(
            SourcePrinter.print(
                IR.subscript(IR.name("xs"), IR.slice(IR.number(1), IR.empty(), IR.number(2)))))
        .isEqualTo("xs[1::2]");
  }

  @Test
  public void testEmptySetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SourcePrinter.print(IR.set()));
  }

  @Test
  public void testComprehensions() {
    Node listComp =
        IR.listComp(
            IR.name("y"),
            IR.comprehension(
                IR.name("y"), IR.name("items"), IR.compare(">", IR.name("y"), IR.number(0))));
    assertThat(SourcePrinter.print(listComp)).isEqualTo("[y for y in items if (y > 0)]");

    Node dictComp =
        IR.dictComp(
            IR.name("k"),
            IR.name("v"),
            IR.comprehension(
                IR.tuple(IR.name("k"), IR.name("v")),
                IR.call(IR.attribute(IR.name("d"), "items"))));
    assertThat(SourcePrinter.print(dictComp)).isEqualTo("{k: v for (k, v) in d.items()}");
  }

  @Test
  public void testLambdaAndConditionalExpression() {
    Node lambda =
        IR.lambda(
            IR.paramList("x"),
            IR.ifExp(IR.name("x"), IR.name("x"), IR.name("fallback")));
    assertThat(SourcePrinter.print(lambda)).isEqualTo("lambda x: x if x else fallback");
    assertThat(SourcePrinter.print(IR.lambda(IR.paramList(), IR.number(0))))
        .isEqualTo("lambda: 0");
  }

  @Test
  public void testFormattedString() {
    Node fstring =
        IR.joinedStr(
            IR.constant("it's {"),
            IR.formattedValue(IR.name("a")),
            IR.constant("}\\"),
            IR.formattedValue(
                IR.name("b"),
                "r",
                IR.joinedStr(IR.formattedValue(IR.name("w")), IR.constant("d"))),
            IR.formattedValue(IR.set(IR.name("c"))));
    assertThat(SourcePrinter.print(fstring)).isEqualTo("f'it\\'s {{{a}}}\\\\{b!r:{w}d}{ {c}}'");
  }

  @Test
  public void testNamedExpr() {
    Node named = IR.namedExpr(IR.name("n"), IR.binOp("+", IR.name("a"), IR.number(1)));
    assertThat(SourcePrinter.print(IR.call(IR.name("f"), named))).isEqualTo("f((n := a + 1))");
  }

  @Test
  public void testAsyncForms() {
    Node fn =
        IR.asyncFunctionDef(
            "fetch",
            IR.paramList(),
            IR.block(IR.returnNode(IR.await(IR.call(IR.name("get"))))));
    assertThat(SourcePrinter.print(fn))
        .isEqualTo(lines("async def fetch():", "    return await get()"));
  }

  @Test
  public void testExpressionInStatementPosition() {
    assertThrows(
        IllegalArgumentException.class, () -> SourcePrinter.print(IR.block(IR.name("x"))));
  }
}
