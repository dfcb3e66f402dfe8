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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps imported names to the aliases generated for them, independent of scope. The first
 * registration of a name wins.
 */
final class RedirectTable {

  private final Map<String, String> entries = new LinkedHashMap<>();

  /** Returns whether {@code originalName} was not registered before. */
  boolean register(String originalName, String alias) {
    return entries.putIfAbsent(originalName, alias) == null;
  }

  @Nullable String lookup(String originalName) {
    return entries.get(originalName);
  }

  int size() {
    return entries.size();
  }

  ImmutableMap<String, String> asMap() {
    return ImmutableMap.copyOf(entries);
  }
}
