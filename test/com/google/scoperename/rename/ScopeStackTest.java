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
import static org.junit.Assert.assertThrows;

import com.google.scoperename.ast.IR;
import com.google.scoperename.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeStackTest {

  private final Node root = IR.module();
  private AliasMap.Builder aliasMap;
  private ScopeStack scopes;
  private int minted;

  @Before
  public void setUp() {
    aliasMap = AliasMap.builder();
    minted = 0;
    scopes = new ScopeStack(name -> name + "_" + (++minted), aliasMap, 4);
    scopes.push(Scope.Kind.MODULE, root);
  }

  @Test
  public void testBindIsIdempotentWithinAFrame() {
    assertThat(scopes.bind("x")).isEqualTo("x_1");
    assertThat(scopes.bind("x")).isEqualTo("x_1");
    assertThat(minted).isEqualTo(1);
  }

  @Test
  public void testInnerFrameShadowsOuter() {
    scopes.bind("x");
    scopes.push(Scope.Kind.FUNCTION, root);
    assertThat(scopes.lookup("x")).isEqualTo("x_1");
    assertThat(scopes.bind("x")).isEqualTo("x_2");
    assertThat(scopes.lookup("x")).isEqualTo("x_2");
    scopes.pop();
    assertThat(scopes.lookup("x")).isEqualTo("x_1");
  }

  @Test
  public void testPopDiscardsBindings() {
    scopes.push(Scope.Kind.COMPREHENSION, root);
    scopes.bind("y");
    scopes.pop();
    assertThat(scopes.lookup("y")).isNull();
    assertThat(scopes.getDepth()).isEqualTo(1);
  }

  @Test
  public void testLookupOfUnboundName() {
    assertThat(scopes.lookup("missing")).isNull();
  }

  @Test
  public void testLookupInOutermost() {
    scopes.bind("g");
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.bind("local");
    assertThat(scopes.lookupInOutermost("g")).isEqualTo("g_1");
    assertThat(scopes.lookupInOutermost("local")).isNull();
  }

  @Test
  public void testLookupEnclosingSkipsInnermostAndModule() {
    scopes.bind("n");
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.bind("m");
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.bind("m");
    scopes.bind("k");

    assertThat(scopes.lookupEnclosing("m")).isEqualTo("m_2");
    assertThat(scopes.lookupEnclosing("k")).isNull();
    assertThat(scopes.lookupEnclosing("n")).isNull();
  }

  @Test
  public void testDeclareRedirectsLaterBinds() {
    scopes.bind("c");
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.declare("c", "c_1");
    assertThat(scopes.bind("c")).isEqualTo("c_1");
    assertThat(scopes.peek().getOwnBinding("c").kind()).isEqualTo(Binding.Kind.REDIRECTED);
  }

  @Test
  public void testBindVerbatimReplacesAlias() {
    scopes.bind("os");
    scopes.bindVerbatim("os");
    assertThat(scopes.lookup("os")).isEqualTo("os");
    assertThat(scopes.bind("os")).isEqualTo("os");
  }

  @Test
  public void testOnlyRenamedBindingsAreReported() {
    ScopeStack identity = new ScopeStack(name -> name, aliasMap, 4);
    identity.push(Scope.Kind.MODULE, root);
    identity.bind("same");
    scopes.bind("x");
    AliasMap map = aliasMap.build();
    assertThat(map.getAliases("same")).isEmpty();
    assertThat(map.getAliases("x")).containsExactly("x_1");
  }

  @Test
  public void testNestingLimit() {
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.push(Scope.Kind.CLASS, root);
    scopes.push(Scope.Kind.LAMBDA, root);
    RenamingException e =
        assertThrows(RenamingException.class, () -> scopes.push(Scope.Kind.LOOP, root));
    assertThat(e.getType()).isEqualTo(RenamingErrors.NESTING_LIMIT_EXCEEDED);
    assertThat(scopes.getDepth()).isEqualTo(4);
  }

  @Test
  public void testFramesRecordTheirKindAndDepth() {
    Scope scope = scopes.push(Scope.Kind.RESOURCE, root);
    assertThat(scope.getKind()).isEqualTo(Scope.Kind.RESOURCE);
    assertThat(scope.getKind().isBlock()).isTrue();
    assertThat(scope.getDepth()).isEqualTo(1);
    assertThat(Scope.Kind.FUNCTION.isBlock()).isFalse();
  }

  @Test
  public void testLoopFrameHonoursDeclarationAroundIt() {
    scopes.bind("counter");
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.declare("counter", "counter_1");
    scopes.push(Scope.Kind.LOOP, root);
    scopes.push(Scope.Kind.RESOURCE, root);

    assertThat(scopes.bind("counter")).isEqualTo("counter_1");
    assertThat(minted).isEqualTo(1);
    assertThat(scopes.peek().getOwnBinding("counter").kind())
        .isEqualTo(Binding.Kind.REDIRECTED);
  }

  @Test
  public void testLoopFrameShadowsOrdinaryBindingAroundIt() {
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.bind("total");
    scopes.push(Scope.Kind.LOOP, root);
    assertThat(scopes.bind("total")).isEqualTo("total_2");
  }

  @Test
  public void testDeclarationDoesNotCrossFunctionFrames() {
    scopes.push(Scope.Kind.FUNCTION, root);
    scopes.declare("g", "g");
    scopes.push(Scope.Kind.FUNCTION, root);
    assertThat(scopes.bind("g")).isEqualTo("g_1");
  }

  @Test
  public void testBindOutsideComprehensions() {
    scopes.push(Scope.Kind.FUNCTION, root);
    Scope function = scopes.peek();
    scopes.push(Scope.Kind.COMPREHENSION, root);
    scopes.push(Scope.Kind.COMPREHENSION, root);

    assertThat(scopes.bindOutsideComprehensions("last")).isEqualTo("last_1");
    assertThat(function.getOwnBinding("last")).isEqualTo(Binding.declared("last", "last_1"));
    assertThat(scopes.peek().getOwnBinding("last")).isNull();
    assertThat(scopes.lookup("last")).isEqualTo("last_1");
    assertThat(scopes.bindOutsideComprehensions("last")).isEqualTo("last_1");
  }

  @Test
  public void testPopOfEmptyStack() {
    scopes.pop();
    assertThat(scopes.isEmpty()).isTrue();
    assertThrows(IllegalStateException.class, () -> scopes.pop());
  }
}
