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

import com.google.errorprone.annotations.FormatMethod;
import java.util.Locale;

/**
 * All errors detected while assembling a program throw a BuildError. None of them are recoverable:
 * the scope that was being built when the error was thrown is rolled back, and the caller must fix
 * the construction code.
 */
public class BuildError extends RuntimeException {

  /** The broad category of a BuildError. */
  public enum Kind {
    /** A value of the wrong kind was passed, e.g. a non-boolean loop condition. */
    TYPE,

    /** A construct method was called in the wrong lifecycle state. */
    SEQUENCING,

    /**
     * The program being built is malformed, e.g. a captured name that no enclosing block defines,
     * or a branch that declares no outputs.
     */
    STRUCTURAL,

    /** Inputs disagree on their dimensions. */
    SHAPE
  }

  public final Kind kind;
  public final String msg;

  public BuildError(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s error)", msg, kind.name().toLowerCase(Locale.ROOT));
  }

  /** Returns a new TYPE BuildError. */
  @FormatMethod
  static BuildError typeError(String fmt, Object... fmtArgs) {
    return new BuildError(Kind.TYPE, String.format(fmt, fmtArgs));
  }

  /** Returns a new SEQUENCING BuildError. */
  @FormatMethod
  static BuildError sequencing(String fmt, Object... fmtArgs) {
    return new BuildError(Kind.SEQUENCING, String.format(fmt, fmtArgs));
  }

  /** Returns a new STRUCTURAL BuildError. */
  @FormatMethod
  static BuildError structural(String fmt, Object... fmtArgs) {
    return new BuildError(Kind.STRUCTURAL, String.format(fmt, fmtArgs));
  }

  /** Returns a new SHAPE BuildError. */
  @FormatMethod
  static BuildError shape(String fmt, Object... fmtArgs) {
    return new BuildError(Kind.SHAPE, String.format(fmt, fmtArgs));
  }
}
