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

/** Thrown when a tree cannot be renamed. No partially renamed tree is ever returned. */
public final class RenamingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final RenamingError error;

  public RenamingException(RenamingError error) {
    super(error.format());
    this.error = error;
  }

  public RenamingError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
