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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RedirectTableTest {

  @Test
  public void testFirstRegistrationWins() {
    RedirectTable table = new RedirectTable();
    assertThat(table.register("os", "n1")).isTrue();
    assertThat(table.register("os", "n2")).isFalse();
    assertThat(table.lookup("os")).isEqualTo("n1");
  }

  @Test
  public void testLookupOfUnknownName() {
    assertThat(new RedirectTable().lookup("sys")).isNull();
  }

  @Test
  public void testAsMapKeepsRegistrationOrder() {
    RedirectTable table = new RedirectTable();
    table.register("b", "n1");
    table.register("a", "n2");
    assertThat(table.asMap()).containsExactly("b", "n1", "a", "n2").inOrder();
    assertThat(table.size()).isEqualTo(2);
  }

  @Test
  public void testAsMapIsACopy() {
    RedirectTable table = new RedirectTable();
    ImmutableMap<String, String> before = table.asMap();
    table.register("a", "n1");
    assertThat(before).isEmpty();
  }
}
