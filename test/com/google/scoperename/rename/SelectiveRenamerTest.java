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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.scoperename.ast.IR;
import com.google.scoperename.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the {@link RenamingOptions.Policy#SELECTIVE} policy. */
@RunWith(JUnit4.class)
public final class SelectiveRenamerTest extends RenamerTestCase {

  @Before
  public void setUp() {
    options.setPolicy(RenamingOptions.Policy.SELECTIVE);
  }

  @Test
  public void testImportShadowedByParameter() {
    test(
        IR.module(
            IR.importNode(IR.alias("foo")),
            IR.functionDef("f", IR.paramList("foo"), IR.block(IR.returnNode(IR.name("foo")))),
            IR.exprStmt(IR.call(IR.attribute(IR.name("foo"), "bar")))),
        lines(
            "import foo as foo$1",
            "def f(foo):",
            "    return foo",
            "foo$1.bar()"));
  }

  @Test
  public void testImportUsedInFormattedString() {
    test(
        IR.module(
            IR.importNode(IR.alias("json")),
            IR.assign(
                IR.name("s"),
                IR.joinedStr(
                    IR.formattedValue(
                        IR.call(IR.attribute(IR.name("json"), "dumps"), IR.name("d")))))),
        lines(
            "import json as json$1", //
            "s = f'{json$1.dumps(d)}'"));
  }

  @Test
  public void testOrdinaryBindingsAreNotRenamed() {
    testSame(
        IR.module(
            IR.assign(IR.name("x"), IR.number(1)),
            IR.functionDef(
                "f",
                IR.paramList("a"),
                IR.block(IR.returnNode(IR.binOp("+", IR.name("a"), IR.name("x"))))),
            IR.classDef("C", IR.bases(), IR.block(IR.pass()))));
  }

  @Test
  public void testExplicitAliasIsKept() {
    testSame(
        IR.module(
            IR.importNode(IR.alias("numpy", "np")),
            IR.exprStmt(IR.call(IR.attribute(IR.name("np"), "array")))));
  }

  @Test
  public void testDottedImportIsKept() {
    testSame(
        IR.module(
            IR.importNode(IR.alias("os.path")),
            IR.exprStmt(IR.call(IR.attribute(IR.attribute(IR.name("os"), "path"), "join")))));
  }

  @Test
  public void testFromImport() {
    test(
        IR.module(
            IR.importFrom("os", IR.alias("path")),
            IR.exprStmt(IR.call(IR.attribute(IR.name("path"), "join")))),
        lines(
            "from os import path as path$1", //
            "path$1.join()"));
  }

  @Test
  public void testComprehensionTargetShadowsImport() {
    test(
        IR.module(
            IR.importNode(IR.alias("os")),
            IR.exprStmt(IR.listComp(IR.name("os"), IR.comprehension(IR.name("os"), IR.name("xs")))),
            IR.exprStmt(IR.call(IR.attribute(IR.name("os"), "getcwd")))),
        lines(
            "import os as os$1", //
            "[os for os in xs]",
            "os$1.getcwd()"));
  }

  @Test
  public void testRebindingOnlyAffectsLaterUses() {
    test(
        IR.module(
            IR.importNode(IR.alias("json")),
            IR.assign(IR.name("x"), IR.call(IR.attribute(IR.name("json"), "dumps"))),
            IR.assign(IR.name("json"), IR.constant("None")),
            IR.assign(IR.name("y"), IR.name("json"))),
        lines(
            "import json as json$1",
            "x = json$1.dumps()",
            "json = None",
            "y = json"));
  }

  @Test
  public void testImportInsideFunctionIsVisibleEverywhere() {
    test(
        IR.module(
            IR.functionDef(
                "setup",
                IR.paramList(),
                IR.block(IR.importNode(IR.alias("cfg")), IR.returnNode(IR.name("cfg")))),
            IR.exprStmt(IR.call(IR.attribute(IR.name("cfg"), "load")))),
        lines(
            "def setup():",
            "    import cfg as cfg$1",
            "    return cfg$1",
            "cfg$1.load()"));
  }

  @Test
  public void testRepeatedImportReusesAlias() {
    Node module =
        IR.module(
            IR.importNode(IR.alias("re")),
            IR.functionDef("f", IR.paramList(), IR.block(IR.importNode(IR.alias("re")))));
    test(
        module,
        lines(
            "import re as re$1", //
            "def f():",
            "    import re as re$1"));

    RenameResult result = rename(module);
    assertThat(result.getAliasMap().getAliases("re")).containsExactly("re$1");
    assertThat(result.getRedirectTable()).isEqualTo(ImmutableMap.of("re", "re$1"));
  }

  @Test
  public void testGlobalRedirectsLaterStores() {
    test(
        IR.module(
            IR.importNode(IR.alias("log")),
            IR.functionDef(
                "f",
                IR.paramList(),
                IR.block(IR.global("log"), IR.assign(IR.name("log"), IR.number(1))))),
        lines(
            "import log as log$1",
            "def f():",
            "    global log$1",
            "    log$1 = 1"));
  }

  @Test
  public void testGlobalOfOrdinaryNameIsKept() {
    testSame(
        IR.module(
            IR.assign(IR.name("n"), IR.number(0)),
            IR.functionDef(
                "f",
                IR.paramList(),
                IR.block(IR.global("n"), IR.assign(IR.name("n"), IR.number(1))))));
  }

  @Test
  public void testDeleteOfImport() {
    test(
        IR.module(IR.importNode(IR.alias("tmp")), IR.delete(IR.name("tmp"))),
        lines(
            "import tmp as tmp$1", //
            "del tmp$1"));
  }

  @Test
  public void testMalformedTargetIsStillAnError() {
    testError(
        IR.module(IR.assign(IR.starred(IR.name("a")), IR.name("b"))),
        RenamingErrors.MALFORMED_TARGET);
  }
}
