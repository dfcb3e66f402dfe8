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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class KeywordsTest {

  @Test
  public void testKeywords() {
    assertThat(Keywords.isKeyword("lambda")).isTrue();
    assertThat(Keywords.isKeyword("None")).isTrue();
    assertThat(Keywords.isKeyword("print")).isFalse();
    assertThat(Keywords.isKeyword("match")).isFalse();
  }

  @Test
  public void testIdentifiers() {
    assertThat(Keywords.isIdentifier("x")).isTrue();
    assertThat(Keywords.isIdentifier("_private")).isTrue();
    assertThat(Keywords.isIdentifier("nAb3xY9z0")).isTrue();
    assertThat(Keywords.isIdentifier("")).isFalse();
    assertThat(Keywords.isIdentifier("9lives")).isFalse();
    assertThat(Keywords.isIdentifier("a-b")).isFalse();
    assertThat(Keywords.isIdentifier("x$1")).isFalse();
    assertThat(Keywords.isIdentifier("class")).isFalse();
  }
}
