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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.scoperename.ast.Node;

/**
 * A renaming error, with the position of the offending node when it is known.
 *
 * @param type The type of the error
 * @param description Description of the error
 * @param lineno Line number with 1 being the first line, or -1 if unknown
 * @param charno Column number with 0 being the first column, or -1 if unknown
 */
public record RenamingError(DiagnosticType type, String description, int lineno, int charno) {

  public RenamingError {
    checkNotNull(type);
    checkNotNull(description);
  }

  /** Creates an error without a position. */
  public static RenamingError make(DiagnosticType type, Object... arguments) {
    return new RenamingError(type, type.format(arguments), -1, -1);
  }

  /** Creates an error located at {@code n}. */
  public static RenamingError make(Node n, DiagnosticType type, Object... arguments) {
    return new RenamingError(type, type.format(arguments), n.getLineno(), n.getCharno());
  }

  public String getKey() {
    return type.key;
  }

  /** Formats the error as {@code KEY: description at line:col}. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append(type.key).append(": ").append(description);
    if (lineno != -1) {
      sb.append(" at ").append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return format();
  }
}
