// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.autodep.syntax;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A SyntaxError represents a static error associated with a specific position in a file. */
public final class SyntaxError {

  private final String file;
  private final int line;
  private final int column;
  private final String message;

  public SyntaxError(String file, int line, int column, String message) {
    this.file = file;
    this.line = line;
    this.column = column;
    this.message = message;
  }

  public String file() {
    return file;
  }

  /** Returns the 1-based line number of the error. */
  public int line() {
    return line;
  }

  /** Returns the 1-based column number of the error. */
  public int column() {
    return column;
  }

  public String message() {
    return message;
  }

  /** Returns a string of the form "file:line:column: message". */
  @Override
  public String toString() {
    return String.format("%s:%d:%d: %s", file, line, column, message);
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors.
   *
   * <p>SyntaxError.Exception is thrown only by the convenience parsing entry points that accept a
   * single expression. {@link BuildFile#parse} returns its errors in a list rather than throwing,
   * because a caller can still make use of a partially parsed file.
   */
  public static final class Exception extends java.lang.Exception {
    private final ImmutableList<SyntaxError> errors;

    /** Construct a SyntaxError from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("no errors");
      }
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      return Joiner.on("\n").join(errors);
    }
  }
}
