/*
 * Copyright 2025 The Blockflow Authors
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

package org.blockflow.layers;

import org.blockflow.program.Block;
import org.blockflow.program.Program;

/**
 * A ScopeGuard enters a new child scope of a Program when created, and exits it exactly once when
 * closed. Unless {@link #commit} was called first, closing rolls the scope back, so a scope that is
 * left by an exception leaves no trace in the Program.
 *
 * <p>Intended for use in a try-with-resources statement:
 *
 * <pre>
 *   try (ScopeGuard scope = ScopeGuard.enter(program)) {
 *     body.build();
 *     emitCompositeOp(scope.block());
 *     scope.commit();
 *   }
 * </pre>
 */
final class ScopeGuard implements AutoCloseable {
  private final Program program;
  private final Program.ScopeMark mark;
  private boolean committed;
  private boolean closed;

  private ScopeGuard(Program program) {
    this.program = program;
    this.mark = program.enterScope();
  }

  /** Creates a child of the Program's current block and makes it current. */
  static ScopeGuard enter(Program program) {
    return new ScopeGuard(program);
  }

  /** The block created for this scope. */
  Block block() {
    return program.block(mark.blockIndex());
  }

  /** Keeps the scope's block (and everything added while it was current) when the guard closes. */
  void commit() {
    committed = true;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      program.exitScope(mark, committed);
    }
  }
}
